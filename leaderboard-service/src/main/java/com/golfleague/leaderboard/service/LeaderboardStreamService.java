package com.golfleague.leaderboard.service;

import com.golfleague.common.model.LeaderboardEntry;
import com.golfleague.common.model.RoundChangeEvent;
import com.golfleague.common.model.ScoreType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.List;

/**
 * Live event leaderboards.
 *
 * <p>Round-change signals from every event flow through one multicast sink.
 * Each subscriber sees its event's leaderboard once on connect, then one
 * recomputation per quiet period of {@code leaderboard.realtime.debounce}
 * after changes to that event. Recomputes for one subscriber run one at a time.
 */
@Service
public class LeaderboardStreamService {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardStreamService.class);

    private final LeaderboardService leaderboardService;
    private final Duration debounce;

    // changes published while no stream is open are dropped; every new stream starts from a full load
    private final Sinks.Many<RoundChangeEvent> changeSink =
        Sinks.many().multicast().directBestEffort();

    public LeaderboardStreamService(LeaderboardService leaderboardService,
                                    @Value("${leaderboard.realtime.debounce:500ms}") Duration debounce) {
        this.leaderboardService = leaderboardService;
        this.debounce = debounce;
    }

    public void publishChange(RoundChangeEvent event) {
        Sinks.EmitResult result = changeSink.tryEmitNext(event);
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Round change ignored; no live leaderboards open. eventId={} roundId={}",
                      event.eventId(), event.roundId());
        } else if (result.isFailure()) {
            log.warn("Round change dropped. eventId={} roundId={} result={}",
                     event.eventId(), event.roundId(), result);
        } else {
            log.debug("Round change accepted. eventId={} roundId={} type={}",
                      event.eventId(), event.roundId(), event.changeType());
        }
    }

    /**
     * @throws com.golfleague.common.exception.InvalidInputException when the event id is malformed
     */
    public Flux<List<LeaderboardEntry>> stream(String eventId, ScoreType sortBy) {
        String canonicalId = leaderboardService.parseEventId(eventId).toString();

        Flux<String> changes = changeSink.asFlux()
            .filter(e -> canonicalId.equalsIgnoreCase(e.eventId()))
            .sampleTimeout(e -> Mono.delay(debounce))
            .map(e -> "change");

        // the sink subscription is in place before the initial load runs, so no change slips between them
        return Flux.merge(changes, Flux.just("initial"))
            .concatMap(trigger -> leaderboardService.computeEventLeaderboard(canonicalId, sortBy)
                .onErrorResume(e -> {
                    log.warn("Live leaderboard recompute failed; keeping last result. eventId={} trigger={}",
                             eventId, trigger, e);
                    return Mono.empty();
                }))
            .doOnSubscribe(s -> log.info("Live leaderboard subscribed. eventId={} sortBy={}", eventId, sortBy))
            .doFinally(signal -> log.info("Live leaderboard closed. eventId={} signal={}", eventId, signal));
    }
}
