package com.golfleague.leaderboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Read projection: an event round of a player on a team for that season.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TeamScoreRow {

    private UUID teamId;

    private String teamName;

    private UUID userId;

    private int totalScore;

    private Integer courseHandicap;
}
