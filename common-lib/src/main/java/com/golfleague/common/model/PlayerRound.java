package com.golfleague.common.model;

import java.time.LocalDate;

/**
 * A player's round as consumed by {@code PlayerStatsAggregator}. {@code courseName}
 * is null when the course record is gone.
 */
public record PlayerRound(
    String    roundId,
    int       score,
    String    courseName,
    LocalDate playedDate
) {}
