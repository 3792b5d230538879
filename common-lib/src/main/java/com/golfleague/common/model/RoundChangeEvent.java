package com.golfleague.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Signal that a round belonging to an event was inserted, updated or deleted.
 * Carries no round payload; receivers recompute from storage.
 */
public record RoundChangeEvent(
    @JsonProperty("eventId")    String  eventId,
    @JsonProperty("roundId")    String  roundId,
    @JsonProperty("changeType") String  changeType,
    @JsonProperty("occurredAt") Instant occurredAt
) {

    public static RoundChangeEvent updated(String eventId, String roundId) {
        return new RoundChangeEvent(eventId, roundId, "UPDATE", Instant.now());
    }
}
