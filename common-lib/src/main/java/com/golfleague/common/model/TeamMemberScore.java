package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A team member's round within an event, as needed for team totals.
 */
public record TeamMemberScore(
    @JsonProperty("teamId")         String  teamId,
    @JsonProperty("teamName")       String  teamName,
    @JsonProperty("userId")         String  userId,
    @JsonProperty("grossScore")     int     grossScore,
    @JsonProperty("courseHandicap") Integer courseHandicap
) {}
