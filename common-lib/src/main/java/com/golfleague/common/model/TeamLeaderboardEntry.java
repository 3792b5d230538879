package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Team row of an event leaderboard: member gross and net scores summed per team.
 */
public record TeamLeaderboardEntry(
    @JsonProperty("teamId")          String teamId,
    @JsonProperty("teamName")        String teamName,
    @JsonProperty("totalGrossScore") int    totalGrossScore,
    @JsonProperty("totalNetScore")   int    totalNetScore,
    @JsonProperty("memberCount")     int    memberCount,
    @JsonProperty("position")        int    position
) {

    public int score(ScoreType type) {
        return type == ScoreType.GROSS ? totalGrossScore : totalNetScore;
    }

    public TeamLeaderboardEntry withPosition(int newPosition) {
        return new TeamLeaderboardEntry(teamId, teamName, totalGrossScore, totalNetScore,
            memberCount, newPosition);
    }
}
