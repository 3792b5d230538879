package com.golfleague.leaderboard.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Read-only view of a round. Leaderboards never write; handicap-service owns
 * the handicap columns.
 */
@Data
@NoArgsConstructor
@Table("rounds")
public class Round {

    @Id
    private UUID id;

    private UUID userId;

    private UUID eventId;

    private UUID courseId;

    private LocalDate playedDate;

    private Integer totalScore;

    private Integer courseHandicap;
}
