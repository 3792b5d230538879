package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hole counts bucketed by strokes relative to par. Anything two or more under
 * counts as an eagle; anything three or more over counts as worse.
 */
public record ScoringDistribution(
    @JsonProperty("eagles")       int eagles,
    @JsonProperty("birdies")      int birdies,
    @JsonProperty("pars")         int pars,
    @JsonProperty("bogeys")       int bogeys,
    @JsonProperty("doubleBogeys") int doubleBogeys,
    @JsonProperty("worse")        int worse
) {

    public static final ScoringDistribution EMPTY = new ScoringDistribution(0, 0, 0, 0, 0, 0);

    public int totalHoles() {
        return eagles + birdies + pars + bogeys + doubleBogeys + worse;
    }
}
