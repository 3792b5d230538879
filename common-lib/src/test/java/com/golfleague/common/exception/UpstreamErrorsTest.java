package com.golfleague.common.exception;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class UpstreamErrorsTest {

    @Test
    void storageFailureBecomesUpstreamFetchException() {
        Mono<String> failing = Mono.error(new IllegalStateException("connection refused"));

        StepVerifier.create(UpstreamErrors.guard(failing, "leaderboard", "rounds for event e1"))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(UpstreamFetchException.class, e);
                assertEquals("[leaderboard] Failed to fetch rounds for event e1: connection refused", e.getMessage());
                assertInstanceOf(IllegalStateException.class, e.getCause());
            })
            .verify();
    }

    @Test
    void leagueExceptionsPassThroughUnchanged() {
        Flux<String> failing = Flux.error(new RoundNotFoundException("r1"));

        StepVerifier.create(UpstreamErrors.guard(failing, "handicap", "round r1"))
            .expectError(RoundNotFoundException.class)
            .verify();
    }

    @Test
    void valuesPassThrough() {
        StepVerifier.create(UpstreamErrors.guard(Flux.just(1, 2), "handicap", "numbers"))
            .expectNext(1, 2)
            .verifyComplete();
    }
}
