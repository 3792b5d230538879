package com.golfleague.common.exception;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Wraps storage calls so any failure that is not already a {@link LeagueException}
 * reaches the caller as an {@link UpstreamFetchException} with a readable message.
 *
 * <p>Usage pattern:
 * <pre>
 *     UpstreamErrors.guard(roundRepository.findById(id), "leaderboard", "round " + id)
 * </pre>
 *
 * <p>No retries are attempted here.
 */
public final class UpstreamErrors {

    private UpstreamErrors() {}

    public static <T> Mono<T> guard(Mono<T> source, String component, String what) {
        return source.onErrorMap(e -> !(e instanceof LeagueException),
            e -> new UpstreamFetchException(component, "Failed to fetch " + what + ": " + e.getMessage(), e));
    }

    public static <T> Flux<T> guard(Flux<T> source, String component, String what) {
        return source.onErrorMap(e -> !(e instanceof LeagueException),
            e -> new UpstreamFetchException(component, "Failed to fetch " + what + ": " + e.getMessage(), e));
    }
}
