package com.golfleague.handicap.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Insert-only snapshot of a player's Handicap Index, used for trend display.
 */
@Data
@NoArgsConstructor
@Table("handicap_history")
public class HandicapHistory {

    @Id
    private UUID id;

    private UUID userId;

    private double handicapIndex;

    private LocalDate calculatedDate;

    private int roundsUsed;

    private LocalDateTime createdAt;
}
