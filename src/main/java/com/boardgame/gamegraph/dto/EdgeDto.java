package com.boardgame.gamegraph.dto;

import com.boardgame.gamegraph.model.SimilarityEdge;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of edges.json.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"source", "target", "weight"})
public class EdgeDto {

    private String source;
    private String target;
    private double weight;

    public static EdgeDto from(SimilarityEdge edge) {
        return new EdgeDto(edge.source(), edge.target(), edge.weight());
    }
}
