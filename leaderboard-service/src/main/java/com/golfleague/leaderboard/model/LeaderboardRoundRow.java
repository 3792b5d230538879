package com.golfleague.leaderboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Read projection: a round joined with the player's name and current index and
 * the course par. Profile and course columns are null when the join misses.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardRoundRow {

    private UUID roundId;

    private UUID userId;

    private String firstName;

    private String lastName;

    private int totalScore;

    private Integer courseHandicap;

    private Double currentHandicapIndex;

    private Integer totalPar;

    private LocalDate playedDate;
}
