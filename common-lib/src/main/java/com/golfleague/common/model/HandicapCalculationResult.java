package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a Handicap Index calculation.
 *
 * <ul>
 *   <li>{@code handicapIndex} – average of the best differentials, one decimal place.</li>
 *   <li>{@code numberOfScoresUsed} – N from the rounds-to-differentials table.</li>
 *   <li>{@code scoresUsed} – the N rounds that produced the lowest differentials,
 *       best first.</li>
 *   <li>{@code averageDifferential} – the unrounded average.</li>
 * </ul>
 */
public record HandicapCalculationResult(
    @JsonProperty("handicapIndex")       double                      handicapIndex,
    @JsonProperty("numberOfScoresUsed")  int                         numberOfScoresUsed,
    @JsonProperty("scoresUsed")          List<ScoreDifferentialData> scoresUsed,
    @JsonProperty("averageDifferential") double                      averageDifferential
) {}
