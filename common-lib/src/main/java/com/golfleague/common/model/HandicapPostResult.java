package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of a post-for-handicap request.
 *
 * <p>{@code posted} is false only when the round failed the eligibility
 * pre-check. A posted round may still carry a null {@code handicapIndex} when
 * fewer than five posted rounds exist or the index recompute failed.
 */
public record HandicapPostResult(
    @JsonProperty("roundId")            String  roundId,
    @JsonProperty("posted")             boolean posted,
    @JsonProperty("courseHandicap")     Integer courseHandicap,
    @JsonProperty("adjustedGrossScore") Integer adjustedGrossScore,
    @JsonProperty("scoreDifferential")  Double  scoreDifferential,
    @JsonProperty("handicapIndex")      Double  handicapIndex,
    @JsonProperty("message")            String  message
) {

    public static HandicapPostResult ineligible(String roundId, String reason) {
        return new HandicapPostResult(roundId, false, null, null, null, null, reason);
    }

    public HandicapPostResult withHandicapIndex(Double index, String newMessage) {
        return new HandicapPostResult(roundId, posted, courseHandicap, adjustedGrossScore,
            scoreDifferential, index, newMessage);
    }
}
