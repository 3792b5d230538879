package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * A single round as consumed by the leaderboard aggregator.
 *
 * <p>{@code courseHandicap} is the snapshot captured when the round was posted
 * and may be null for rounds never posted for handicap. {@code coursePar} may be
 * null when the course record carries no par.
 */
public record RoundScore(
    @JsonProperty("roundId")        String    roundId,
    @JsonProperty("userId")         String    userId,
    @JsonProperty("userName")       String    userName,
    @JsonProperty("grossScore")     int       grossScore,
    @JsonProperty("courseHandicap") Integer   courseHandicap,
    @JsonProperty("handicapIndex")  Double    handicapIndex,
    @JsonProperty("coursePar")      Integer   coursePar,
    @JsonProperty("playedDate")     LocalDate playedDate
) {}
