package com.boardgame.gamegraph.dto;

import com.boardgame.gamegraph.model.Game;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of nodes.json, as read by the graph viewer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"id", "label", "name", "averagerating", "averageweight", "minplayers",
        "maxplayers", "playingtime", "mechanics", "categories", "bggUrl"})
public class GameNodeDto {

    private String id;
    private String label;
    private String name;

    @JsonProperty("averagerating")
    private Double averageRating;

    @JsonProperty("averageweight")
    private Double averageWeight;

    @JsonProperty("minplayers")
    private Integer minPlayers;

    @JsonProperty("maxplayers")
    private Integer maxPlayers;

    @JsonProperty("playingtime")
    private Integer playingTime;

    @Builder.Default
    private List<String> mechanics = new ArrayList<>();

    @Builder.Default
    private List<String> categories = new ArrayList<>();

    @JsonProperty("bggUrl")
    private String bggUrl;

    public static GameNodeDto from(Game game) {
        return GameNodeDto.builder()
                .id(game.getId())
                .label(game.getName())
                .name(game.getName())
                .averageRating(game.getAverageRating())
                .averageWeight(game.getAverageWeight())
                .minPlayers(game.getMinPlayers())
                .maxPlayers(game.getMaxPlayers())
                .playingTime(game.getPlayingTime())
                .mechanics(new ArrayList<>(game.getMechanics()))
                .categories(new ArrayList<>(game.getCategories()))
                .bggUrl(game.getBggUrl())
                .build();
    }
}
