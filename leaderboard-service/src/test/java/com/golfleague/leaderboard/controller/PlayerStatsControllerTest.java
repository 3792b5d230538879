package com.golfleague.leaderboard.controller;

import com.golfleague.common.exception.InvalidInputException;
import com.golfleague.common.exception.UpstreamFetchException;
import com.golfleague.common.model.PlayerStats;
import com.golfleague.common.model.RoundSummary;
import com.golfleague.common.model.ScoreTrend;
import com.golfleague.common.model.ScoringDistribution;
import com.golfleague.common.model.StatsSummary;
import com.golfleague.leaderboard.service.PlayerStatsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.Mockito.*;

@WebFluxTest(PlayerStatsController.class)
class PlayerStatsControllerTest {

    private static final String USER = "00000000-0000-0000-0000-00000000000a";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private PlayerStatsService statsService;

    @Test
    void statsRenderWithBestRoundAndDistribution() {
        RoundSummary best = new RoundSummary(LocalDate.of(2025, 6, 3), 79, "Links");
        when(statsService.computePlayerStats(USER)).thenReturn(Mono.just(new PlayerStats(
            3, 84.7, 79, 91, best, new ScoringDistribution(0, 4, 30, 14, 4, 2), List.of(best))));

        webTestClient.get().uri("/api/v1/leaderboard/players/{id}/stats", USER)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.totalRounds").isEqualTo(3)
            .jsonPath("$.averageScore").isEqualTo(84.7)
            .jsonPath("$.bestRound.courseName").isEqualTo("Links")
            .jsonPath("$.scoringAverages.pars").isEqualTo(30)
            .jsonPath("$.recentForm[0].score").isEqualTo(79);
    }

    @Test
    void playerWithoutRoundsOmitsBestRound() {
        when(statsService.computePlayerStats(USER)).thenReturn(Mono.just(PlayerStats.empty()));

        webTestClient.get().uri("/api/v1/leaderboard/players/{id}/stats", USER)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.totalRounds").isEqualTo(0)
            .jsonPath("$.bestRound").doesNotExist()
            .jsonPath("$.recentForm").isEmpty();
    }

    @Test
    void summaryTrendIsLowercase() {
        when(statsService.computeStatsSummary(USER))
            .thenReturn(Mono.just(new StatsSummary(12, 81.4, 76, ScoreTrend.DOWN)));

        webTestClient.get().uri("/api/v1/leaderboard/players/{id}/stats/summary", USER)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.trend").isEqualTo("down")
            .jsonPath("$.lowestScore").isEqualTo(76);
    }

    @Test
    void malformedUserIdIs400() {
        when(statsService.computePlayerStats("nobody"))
            .thenReturn(Mono.error(new InvalidInputException("stats", "Invalid userId: nobody")));

        webTestClient.get().uri("/api/v1/leaderboard/players/nobody/stats")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("INVALID_INPUT");
    }

    @Test
    void storageFailureIs502() {
        when(statsService.computeStatsSummary(USER))
            .thenReturn(Mono.error(new UpstreamFetchException("stats", "recent rounds for player " + USER,
                new IllegalStateException("connection reset"))));

        webTestClient.get().uri("/api/v1/leaderboard/players/{id}/stats/summary", USER)
            .exchange()
            .expectStatus().isEqualTo(502);
    }
}
