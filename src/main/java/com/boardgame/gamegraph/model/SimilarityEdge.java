package com.boardgame.gamegraph.model;

import java.util.Comparator;

/**
 * Undirected weighted edge between two games. Instances are always in canonical
 * order (source sorts before target), so equal pairs produce equal keys.
 */
public record SimilarityEdge(String source, String target, double weight) {

    /**
     * Numeric order when both ids are integers, lexical order otherwise.
     */
    public static final Comparator<String> ID_ORDER = (a, b) -> {
        Long left = parseLong(a);
        Long right = parseLong(b);
        if (left != null && right != null) {
            return Long.compare(left, right);
        }
        return a.compareTo(b);
    };

    public SimilarityEdge {
        if (source.equals(target)) {
            throw new IllegalArgumentException("Self-loop on game " + source);
        }
        if (ID_ORDER.compare(source, target) > 0) {
            throw new IllegalArgumentException("Edge ids not in canonical order: " + source + ", " + target);
        }
    }

    public static SimilarityEdge between(String idA, String idB, double weight) {
        return ID_ORDER.compare(idA, idB) <= 0
                ? new SimilarityEdge(idA, idB, weight)
                : new SimilarityEdge(idB, idA, weight);
    }

    public static String key(String idA, String idB) {
        return ID_ORDER.compare(idA, idB) <= 0 ? idA + "|" + idB : idB + "|" + idA;
    }

    public String key() {
        return source + "|" + target;
    }

    private static Long parseLong(String value) {
        if (value.isEmpty()) {
            return null;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return null;
            }
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
