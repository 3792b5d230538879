package com.golfleague.handicap.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record HandicapHistoryDTO(
    @JsonProperty("userId")         String    userId,
    @JsonProperty("handicapIndex")  double    handicapIndex,
    @JsonProperty("calculatedDate") LocalDate calculatedDate,
    @JsonProperty("roundsUsed")     int       roundsUsed
) {}
