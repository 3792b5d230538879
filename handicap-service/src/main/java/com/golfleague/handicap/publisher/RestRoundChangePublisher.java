package com.golfleague.handicap.publisher;

import com.golfleague.common.event.RoundChangePublisher;
import com.golfleague.common.model.RoundChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST-based implementation of {@link RoundChangePublisher}.
 *
 * <p>Posts the change to leaderboard-service, which debounces and recomputes
 * the event's live leaderboard. Fire-and-forget: no reactor thread is blocked
 * and a failed call is only logged.
 */
@Component
public class RestRoundChangePublisher implements RoundChangePublisher {

    private static final Logger log = LoggerFactory.getLogger(RestRoundChangePublisher.class);

    private final WebClient leaderboardClient;

    public RestRoundChangePublisher(WebClient leaderboardClient) {
        this.leaderboardClient = leaderboardClient;
    }

    @Override
    public void publish(RoundChangeEvent event) {
        leaderboardClient.post()
            .uri("/api/v1/leaderboard/events/{eventId}/changes", event.eventId())
            .bodyValue(event)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Round change published. eventId={} roundId={} status={}",
                                event.eventId(), event.roundId(), r.getStatusCode()),
                err -> log.warn("Round change publish failed (non-critical). eventId={} roundId={}",
                                event.eventId(), event.roundId(), err)
            );
    }
}
