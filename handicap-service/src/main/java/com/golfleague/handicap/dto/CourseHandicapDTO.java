package com.golfleague.handicap.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Strokes a player receives from a tee box. {@code handicapIndex} is null when
 * the player has no established index, in which case {@code courseHandicap} is 0.
 */
public record CourseHandicapDTO(
    @JsonProperty("userId")         String userId,
    @JsonProperty("teeBoxId")       String teeBoxId,
    @JsonProperty("handicapIndex")  Double handicapIndex,
    @JsonProperty("courseHandicap") int    courseHandicap
) {}
