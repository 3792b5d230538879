package com.golfleague.common.model;

import com.golfleague.common.exception.InvalidInputException;

/**
 * Which score a leaderboard is ordered by.
 */
public enum ScoreType {
    GROSS,
    NET;

    /**
     * Parses the {@code sortBy} request parameter, case-insensitively. A missing
     * or blank value means {@link #NET}, the default ordering.
     *
     * @throws InvalidInputException for any other value
     */
    public static ScoreType fromParam(String value) {
        if (value == null || value.isBlank()) return NET;
        try {
            return ScoreType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("leaderboard", "sortBy must be gross or net: " + value);
        }
    }
}
