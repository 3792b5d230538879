package com.golfleague.handicap.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A round submitted by a player. The handicap columns ({@code courseHandicap},
 * {@code adjustedScore}, {@code scoreDifferential}) stay null until the round
 * is posted for handicap; {@code courseHandicap} is then the snapshot used by
 * leaderboards for net scoring.
 */
@Data
@NoArgsConstructor
@Table("rounds")
public class Round {

    @Id
    private UUID id;

    private UUID userId;

    /** Null for casual rounds played outside a league event. */
    private UUID eventId;

    private UUID courseId;

    private UUID teeBoxId;

    private LocalDate playedDate;

    private Integer totalScore;

    private Integer courseHandicap;

    private Integer adjustedScore;

    private Double scoreDifferential;

    @Column("is_posted_for_handicap")
    private boolean postedForHandicap;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
