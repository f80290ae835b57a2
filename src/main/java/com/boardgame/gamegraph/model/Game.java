package com.boardgame.gamegraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A board game with the attributes the similarity graph is built from.
 * Numeric fields are null when BGG has no value for them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Game {

    public static final String BGG_URL_PREFIX = "https://boardgamegeek.com/boardgame/";

    private String id;

    @Builder.Default
    private String name = "";

    @Builder.Default
    private Set<String> mechanics = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> categories = new LinkedHashSet<>();

    private Double averageRating;
    private Double averageWeight;
    private Integer minPlayers;
    private Integer maxPlayers;
    private Integer playingTime;

    public String getBggUrl() {
        return BGG_URL_PREFIX + id;
    }
}
