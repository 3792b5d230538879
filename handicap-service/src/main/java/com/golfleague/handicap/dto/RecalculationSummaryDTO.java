package com.golfleague.handicap.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of an admin-forced recompute across all players. Players with fewer
 * than five posted rounds are counted as {@code skipped}.
 */
public record RecalculationSummaryDTO(
    @JsonProperty("success") int success,
    @JsonProperty("failed")  int failed,
    @JsonProperty("skipped") int skipped
) {}
