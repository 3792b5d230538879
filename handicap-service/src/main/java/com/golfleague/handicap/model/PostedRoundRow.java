package com.golfleague.handicap.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Read projection: a posted round joined with the ratings of the tee box it
 * was played from. Any column may be null on legacy rows.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PostedRoundRow {

    private Integer adjustedScore;

    private Double courseRating;

    private Integer slopeRating;

    private LocalDate playedDate;
}
