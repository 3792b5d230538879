package com.golfleague.leaderboard.controller;

import com.golfleague.common.exception.InvalidInputException;
import com.golfleague.common.exception.UpstreamFetchException;
import com.golfleague.common.model.LeaderboardEntry;
import com.golfleague.common.model.RoundChangeEvent;
import com.golfleague.common.model.ScoreType;
import com.golfleague.common.model.TeamLeaderboardEntry;
import com.golfleague.leaderboard.service.LeaderboardService;
import com.golfleague.leaderboard.service.LeaderboardStreamService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@WebFluxTest(LeaderboardController.class)
class LeaderboardControllerTest {

    private static final String EVENT = "00000000-0000-0000-0000-00000000e001";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private LeaderboardService leaderboardService;

    @MockBean
    private LeaderboardStreamService streamService;

    private static LeaderboardEntry entry(String userId, int gross, int net, int position) {
        return new LeaderboardEntry(userId, "Player " + userId, gross, net, gross - net, 10.2,
            position, "r-" + userId, null, gross - 72);
    }

    @Test
    void eventLeaderboardDefaultsToNet() {
        when(leaderboardService.computeEventLeaderboard(EVENT, ScoreType.NET))
            .thenReturn(Mono.just(List.of(entry("u1", 80, 70, 1), entry("u2", 75, 70, 1))));

        webTestClient.get().uri("/api/v1/leaderboard/events/{id}", EVENT)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(2)
            .jsonPath("$[1].position").isEqualTo(1)
            .jsonPath("$[0].scoreToPar").isEqualTo(8);
    }

    @Test
    void eventLeaderboardSortByGross() {
        when(leaderboardService.computeEventLeaderboard(EVENT, ScoreType.GROSS))
            .thenReturn(Mono.just(List.of(entry("u2", 75, 70, 1))));

        webTestClient.get().uri("/api/v1/leaderboard/events/{id}?sortBy=gross", EVENT)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].userId").isEqualTo("u2");
    }

    @Test
    void unknownSortByIs400() {
        webTestClient.get().uri("/api/v1/leaderboard/events/{id}?sortBy=grss", EVENT)
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("INVALID_INPUT");

        verifyNoInteractions(leaderboardService);
    }

    @Test
    void emptyEventIsOkWithEmptyList() {
        when(leaderboardService.computeEventLeaderboard(EVENT, ScoreType.NET)).thenReturn(Mono.just(List.of()));

        webTestClient.get().uri("/api/v1/leaderboard/events/{id}", EVENT)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .json("[]");
    }

    @Test
    void storageFailureIs502() {
        when(leaderboardService.computeEventLeaderboard(EVENT, ScoreType.NET))
            .thenReturn(Mono.error(new UpstreamFetchException("leaderboard", "Failed to fetch rounds",
                new IllegalStateException("down"))));

        webTestClient.get().uri("/api/v1/leaderboard/events/{id}", EVENT)
            .exchange()
            .expectStatus().isEqualTo(502)
            .expectBody()
            .jsonPath("$.error").isEqualTo("UPSTREAM_FETCH_FAILED");
    }

    @Test
    void seasonStandingsPassYearAndDefaultLimit() {
        when(leaderboardService.computeSeasonStandings(2024, ScoreType.NET, 50))
            .thenReturn(Mono.just(List.of(entry("u1", 81, 79, 1))));

        webTestClient.get().uri("/api/v1/leaderboard/season?year=2024")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].grossScore").isEqualTo(81);
    }

    @Test
    void seasonStandingsRejectNegativeLimit() {
        when(leaderboardService.computeSeasonStandings(null, ScoreType.NET, -5))
            .thenReturn(Mono.error(new InvalidInputException("leaderboard", "limit must not be negative: -5")));

        webTestClient.get().uri("/api/v1/leaderboard/season?limit=-5")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("INVALID_INPUT");
    }

    @Test
    void teamLeaderboard() {
        when(leaderboardService.computeTeamLeaderboard(EVENT, ScoreType.NET))
            .thenReturn(Mono.just(List.of(new TeamLeaderboardEntry("t1", "Eagles", 165, 150, 2, 1))));

        webTestClient.get().uri("/api/v1/leaderboard/events/{id}/teams", EVENT)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].teamName").isEqualTo("Eagles")
            .jsonPath("$[0].totalNetScore").isEqualTo(150);
    }

    @Test
    void changeSignalIsForwardedToStream() {
        when(leaderboardService.parseEventId(EVENT)).thenReturn(UUID.fromString(EVENT));

        webTestClient.post().uri("/api/v1/leaderboard/events/{id}/changes", EVENT)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(RoundChangeEvent.updated(EVENT, "r1"))
            .exchange()
            .expectStatus().isAccepted();

        ArgumentCaptor<RoundChangeEvent> captor = ArgumentCaptor.forClass(RoundChangeEvent.class);
        verify(streamService).publishChange(captor.capture());
        assertEquals(EVENT, captor.getValue().eventId());
        assertEquals("r1", captor.getValue().roundId());
    }

    @Test
    void changeSignalCarriesCanonicalEventId() {
        String upper = EVENT.toUpperCase();
        when(leaderboardService.parseEventId(upper)).thenReturn(UUID.fromString(upper));

        webTestClient.post().uri("/api/v1/leaderboard/events/{id}/changes", upper)
            .exchange()
            .expectStatus().isAccepted();

        ArgumentCaptor<RoundChangeEvent> captor = ArgumentCaptor.forClass(RoundChangeEvent.class);
        verify(streamService).publishChange(captor.capture());
        assertEquals(EVENT.toLowerCase(), captor.getValue().eventId());
    }

    @Test
    void changeSignalWithoutBodyIsAccepted() {
        when(leaderboardService.parseEventId(EVENT)).thenReturn(UUID.fromString(EVENT));

        webTestClient.post().uri("/api/v1/leaderboard/events/{id}/changes", EVENT)
            .exchange()
            .expectStatus().isAccepted();

        verify(streamService).publishChange(any(RoundChangeEvent.class));
    }

    @Test
    void changeSignalForMalformedEventIs400() {
        when(leaderboardService.parseEventId("bogus"))
            .thenThrow(new InvalidInputException("leaderboard", "Invalid eventId: bogus"));

        webTestClient.post().uri("/api/v1/leaderboard/events/bogus/changes")
            .exchange()
            .expectStatus().isBadRequest();

        verifyNoInteractions(streamService);
    }

    @Test
    void streamEmitsLeaderboardEvents() {
        when(streamService.stream(EVENT, ScoreType.NET))
            .thenReturn(Flux.just(List.of(entry("u1", 80, 70, 1))));

        Flux<String> body = webTestClient.get().uri("/api/v1/leaderboard/events/{id}/stream", EVENT)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .exchange()
            .expectStatus().isOk()
            .returnResult(String.class)
            .getResponseBody();

        StepVerifier.create(body)
            .assertNext(data -> assertTrue(data.contains("\"userId\":\"u1\"")))
            .thenCancel()
            .verify();
    }
}
