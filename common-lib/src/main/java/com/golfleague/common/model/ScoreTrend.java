package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a player's recent scoring. {@link #UP} means improving, i.e.
 * lower scores.
 */
public enum ScoreTrend {
    UP,
    DOWN,
    STABLE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}
