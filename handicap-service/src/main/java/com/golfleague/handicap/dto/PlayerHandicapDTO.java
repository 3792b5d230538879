package com.golfleague.handicap.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.golfleague.common.model.ScoreDifferentialData;

import java.util.List;

/**
 * Handicap widget payload: the player's freshly calculated index together with
 * its display form and the rounds that produced it.
 */
public record PlayerHandicapDTO(
    @JsonProperty("userId")              String                      userId,
    @JsonProperty("handicapIndex")       double                      handicapIndex,
    @JsonProperty("display")             String                      display,
    @JsonProperty("numberOfScoresUsed")  int                         numberOfScoresUsed,
    @JsonProperty("averageDifferential") double                      averageDifferential,
    @JsonProperty("scoresUsed")          List<ScoreDifferentialData> scoresUsed
) {}
