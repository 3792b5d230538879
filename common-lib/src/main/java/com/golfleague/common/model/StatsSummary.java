package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lightweight statistics over a player's most recent rounds.
 */
public record StatsSummary(
    @JsonProperty("totalRounds")  int        totalRounds,
    @JsonProperty("averageScore") double     averageScore,
    @JsonProperty("lowestScore")  int        lowestScore,
    @JsonProperty("trend")        ScoreTrend trend
) {

    public static StatsSummary empty() {
        return new StatsSummary(0, 0.0, 0, ScoreTrend.STABLE);
    }
}
