package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One posted round as seen by the handicap calculation: the adjusted gross
 * score and the tee box ratings it was played under.
 *
 * <p>The differential is never carried here; it is always recomputed from
 * these four values.
 */
public record ScoreDifferentialData(
    @JsonProperty("adjustedGrossScore") int       adjustedGrossScore,
    @JsonProperty("courseRating")       double    courseRating,
    @JsonProperty("slopeRating")        int       slopeRating,
    @JsonProperty("playedDate")         LocalDate playedDate
) {}
