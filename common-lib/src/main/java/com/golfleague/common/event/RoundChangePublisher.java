package com.golfleague.common.event;

import com.golfleague.common.model.RoundChangeEvent;

/**
 * Abstraction for announcing that a round belonging to an event changed, so
 * leaderboard views for that event can recompute.
 *
 * <p>Current implementation: {@code RestRoundChangePublisher} in handicap-service,
 * which posts the event to leaderboard-service (fire-and-forget WebClient call).
 */
public interface RoundChangePublisher {

    /**
     * Publish a round change. Implementations MUST be non-blocking; a failed
     * publish must never fail the operation that triggered it.
     *
     * @param event the change to announce; {@code eventId} is never null
     */
    void publish(RoundChangeEvent event);
}
