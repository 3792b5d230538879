package com.golfleague.leaderboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Read projection: one of a player's rounds with the course name, null when the
 * course join misses.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerRoundRow {

    private UUID roundId;

    private int totalScore;

    private LocalDate playedDate;

    private String courseName;
}
