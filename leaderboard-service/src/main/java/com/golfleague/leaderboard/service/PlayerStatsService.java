package com.golfleague.leaderboard.service;

import com.golfleague.common.exception.InvalidInputException;
import com.golfleague.common.exception.UpstreamErrors;
import com.golfleague.common.model.HoleResult;
import com.golfleague.common.model.PlayerRound;
import com.golfleague.common.model.PlayerStats;
import com.golfleague.common.model.StatsSummary;
import com.golfleague.common.stats.PlayerStatsAggregator;
import com.golfleague.leaderboard.model.PlayerRoundRow;
import com.golfleague.leaderboard.repository.LeaderboardRoundRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Per-player statistics. Fetches the player's rounds (and, for full stats, their
 * hole scores) and hands them to {@link PlayerStatsAggregator}.
 *
 * <p>A player with no rounds gets zeroed statistics, not an error.
 */
@Service
public class PlayerStatsService {

    private static final Logger log = LoggerFactory.getLogger(PlayerStatsService.class);

    private static final String COMPONENT = "stats";

    private final LeaderboardRoundRepository roundRepository;

    public PlayerStatsService(LeaderboardRoundRepository roundRepository) {
        this.roundRepository = roundRepository;
    }

    public Mono<PlayerStats> computePlayerStats(String userIdParam) {
        return Mono.defer(() -> {
            UUID userId = parseUserId(userIdParam);
            return UpstreamErrors.guard(roundRepository.findPlayerRounds(userId), COMPONENT, "rounds for player " + userId)
                .map(PlayerStatsService::toPlayerRound)
                .collectList()
                .flatMap(rounds -> rounds.isEmpty()
                    ? Mono.just(PlayerStats.empty())
                    : holeResults(userId).map(holes -> PlayerStatsAggregator.computeStats(rounds, holes)))
                .doOnSuccess(stats -> log.debug("Player stats computed. userId={} rounds={} holes={}",
                                                userId, stats.totalRounds(), stats.scoringAverages().totalHoles()));
        });
    }

    public Mono<StatsSummary> computeStatsSummary(String userIdParam) {
        return Mono.defer(() -> {
            UUID userId = parseUserId(userIdParam);
            return UpstreamErrors.guard(
                    roundRepository.findRecentPlayerRounds(userId, PlayerStatsAggregator.SUMMARY_WINDOW),
                    COMPONENT, "recent rounds for player " + userId)
                .map(PlayerStatsService::toPlayerRound)
                .collectList()
                .map(PlayerStatsAggregator::computeSummary)
                .doOnSuccess(summary -> log.debug("Stats summary computed. userId={} rounds={} trend={}",
                                                  userId, summary.totalRounds(), summary.trend()));
        });
    }

    private Mono<List<HoleResult>> holeResults(UUID userId) {
        return UpstreamErrors.guard(roundRepository.findPlayerHoleScores(userId), COMPONENT, "hole scores for player " + userId)
            .map(row -> new HoleResult(row.getStrokes(), row.getPar()))
            .collectList();
    }

    private static PlayerRound toPlayerRound(PlayerRoundRow row) {
        return new PlayerRound(row.getRoundId().toString(), row.getTotalScore(), row.getCourseName(), row.getPlayedDate());
    }

    private static UUID parseUserId(String userId) {
        try {
            return UUID.fromString(userId);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidInputException(COMPONENT, "Invalid userId: " + userId);
        }
    }
}
