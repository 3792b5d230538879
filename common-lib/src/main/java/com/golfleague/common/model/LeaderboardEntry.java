package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of an event leaderboard or season standings table.
 *
 * <p>Transient: built fresh on every aggregation call and never persisted.
 * {@code position} is 0 until the entry has been ranked. For season standings
 * {@code roundId} is null and {@code thru} carries the number of rounds averaged.
 */
public record LeaderboardEntry(
    @JsonProperty("userId")         String  userId,
    @JsonProperty("userName")       String  userName,
    @JsonProperty("grossScore")     int     grossScore,
    @JsonProperty("netScore")       int     netScore,
    @JsonProperty("courseHandicap") int     courseHandicap,
    @JsonProperty("handicapIndex")  Double  handicapIndex,
    @JsonProperty("position")       int     position,
    @JsonProperty("roundId")        String  roundId,
    @JsonProperty("thru")           Integer thru,
    @JsonProperty("scoreToPar")     Integer scoreToPar
) {

    public int score(ScoreType type) {
        return type == ScoreType.GROSS ? grossScore : netScore;
    }

    public LeaderboardEntry withPosition(int newPosition) {
        return new LeaderboardEntry(userId, userName, grossScore, netScore, courseHandicap,
            handicapIndex, newPosition, roundId, thru, scoreToPar);
    }
}
