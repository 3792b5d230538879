package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record RoundSummary(
    @JsonProperty("date")       LocalDate date,
    @JsonProperty("score")      int       score,
    @JsonProperty("courseName") String    courseName
) {}
