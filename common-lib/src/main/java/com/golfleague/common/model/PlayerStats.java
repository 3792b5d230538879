package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Career statistics for one player. {@code bestRound} is absent for a player
 * with no rounds; every other figure is then zero.
 */
public record PlayerStats(
    @JsonProperty("totalRounds")     int                 totalRounds,
    @JsonProperty("averageScore")    double              averageScore,
    @JsonProperty("lowestScore")     int                 lowestScore,
    @JsonProperty("highestScore")    int                 highestScore,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("bestRound")       RoundSummary        bestRound,
    @JsonProperty("scoringAverages") ScoringDistribution scoringAverages,
    @JsonProperty("recentForm")      List<RoundSummary>  recentForm
) {

    public static PlayerStats empty() {
        return new PlayerStats(0, 0.0, 0, 0, null, ScoringDistribution.EMPTY, List.of());
    }
}
