package com.boardgame.gamegraph.model;

import java.util.function.Function;

/**
 * Numeric game features in the fixed order used to build comparison vectors.
 */
public enum NumericFeature {
    AVERAGE_RATING(Game::getAverageRating),
    AVERAGE_WEIGHT(Game::getAverageWeight),
    MIN_PLAYERS(Game::getMinPlayers),
    MAX_PLAYERS(Game::getMaxPlayers),
    PLAYING_TIME(Game::getPlayingTime);

    private final Function<Game, ? extends Number> accessor;

    NumericFeature(Function<Game, ? extends Number> accessor) {
        this.accessor = accessor;
    }

    /**
     * @return the feature value, or null when the game has none
     */
    public Double valueOf(Game game) {
        Number value = accessor.apply(game);
        return value != null ? value.doubleValue() : null;
    }

    public static boolean hasAny(Game game) {
        for (NumericFeature feature : values()) {
            if (feature.valueOf(game) != null) {
                return true;
            }
        }
        return false;
    }
}
