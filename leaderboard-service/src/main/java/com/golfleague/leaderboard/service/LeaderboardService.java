package com.golfleague.leaderboard.service;

import com.golfleague.common.exception.InvalidInputException;
import com.golfleague.common.exception.UpstreamErrors;
import com.golfleague.common.handicap.HandicapCalculator;
import com.golfleague.common.leaderboard.LeaderboardAggregator;
import com.golfleague.common.model.LeaderboardEntry;
import com.golfleague.common.model.RoundScore;
import com.golfleague.common.model.ScoreType;
import com.golfleague.common.model.TeamLeaderboardEntry;
import com.golfleague.common.model.TeamMemberScore;
import com.golfleague.leaderboard.model.LeaderboardRoundRow;
import com.golfleague.leaderboard.repository.LeaderboardRoundRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read-only leaderboard queries. Fetches rounds and hands them to
 * {@link LeaderboardAggregator}; ranking always runs over the complete set.
 *
 * <p>Storage failures surface as {@code UpstreamFetchException} so callers can
 * tell them apart from an event with no rounds yet (an empty list).
 */
@Service
public class LeaderboardService {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardService.class);

    private static final String COMPONENT = "leaderboard";

    private static final int MIN_SEASON_YEAR = 1900;
    private static final int MAX_SEASON_YEAR = 9999;

    private final LeaderboardRoundRepository roundRepository;

    public LeaderboardService(LeaderboardRoundRepository roundRepository) {
        this.roundRepository = roundRepository;
    }

    public Mono<List<LeaderboardEntry>> computeEventLeaderboard(String eventIdParam, ScoreType sortBy) {
        return Mono.defer(() -> {
            UUID eventId = parseEventId(eventIdParam);
            return UpstreamErrors.guard(roundRepository.findEventRounds(eventId), COMPONENT, "rounds for event " + eventId)
                .map(row -> toRoundScore(row, true))
                .collectList()
                .map(rounds -> LeaderboardAggregator.computeEventLeaderboard(rounds, sortBy))
                .doOnSuccess(entries -> log.debug("Event leaderboard computed. eventId={} sortBy={} entries={}",
                                                  eventId, sortBy, entries.size()));
        });
    }

    /**
     * Season standings over every round played in {@code seasonYear} (1 January
     * to 31 December inclusive), or over all rounds when the year is null.
     *
     * @param limit maximum entries returned; positions are assigned before truncation
     */
    public Mono<List<LeaderboardEntry>> computeSeasonStandings(Integer seasonYear, ScoreType sortBy, int limit) {
        return Mono.defer(() -> {
            if (limit < 0) {
                return Mono.error(new InvalidInputException(COMPONENT, "limit must not be negative: " + limit));
            }
            if (seasonYear != null && (seasonYear < MIN_SEASON_YEAR || seasonYear > MAX_SEASON_YEAR)) {
                return Mono.error(new InvalidInputException(COMPONENT,
                    "year must be between " + MIN_SEASON_YEAR + " and " + MAX_SEASON_YEAR + ": " + seasonYear));
            }
            Flux<LeaderboardRoundRow> rows = seasonYear == null
                ? roundRepository.findAllRounds()
                : roundRepository.findRoundsPlayedBetween(LocalDate.of(seasonYear, 1, 1), LocalDate.of(seasonYear, 12, 31));

            String what = seasonYear == null ? "rounds for all seasons" : "rounds for season " + seasonYear;
            return UpstreamErrors.guard(rows, COMPONENT, what)
                .map(row -> toRoundScore(row, false))
                .collectList()
                .map(rounds -> LeaderboardAggregator.computeSeasonStandings(rounds, sortBy, limit))
                .doOnSuccess(entries -> log.debug("Season standings computed. year={} sortBy={} limit={} entries={}",
                                                  seasonYear, sortBy, limit, entries.size()));
        });
    }

    public Mono<List<TeamLeaderboardEntry>> computeTeamLeaderboard(String eventIdParam, ScoreType sortBy) {
        return Mono.defer(() -> {
            UUID eventId = parseEventId(eventIdParam);
            return UpstreamErrors.guard(roundRepository.findTeamScores(eventId), COMPONENT, "team scores for event " + eventId)
                .map(row -> new TeamMemberScore(row.getTeamId().toString(), row.getTeamName(),
                    row.getUserId().toString(), row.getTotalScore(), row.getCourseHandicap()))
                .collectList()
                .map(scores -> LeaderboardAggregator.computeTeamLeaderboard(scores, sortBy));
        });
    }

    /**
     * Validates an event id without querying storage.
     *
     * @throws InvalidInputException when the id is not a UUID
     */
    public UUID parseEventId(String eventId) {
        try {
            return UUID.fromString(eventId);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidInputException(COMPONENT, "Invalid eventId: " + eventId);
        }
    }

    private RoundScore toRoundScore(LeaderboardRoundRow row, boolean needsPar) {
        if (row.getCourseHandicap() == null) {
            log.debug("Round has no course handicap snapshot; net equals gross. roundId={}", row.getRoundId());
        }
        if (needsPar && row.getTotalPar() == null) {
            log.warn("Course par missing; assuming {}. roundId={}", HandicapCalculator.DEFAULT_PAR, row.getRoundId());
        }
        return new RoundScore(
            row.getRoundId().toString(),
            row.getUserId().toString(),
            displayName(row),
            row.getTotalScore(),
            row.getCourseHandicap(),
            row.getCurrentHandicapIndex(),
            row.getTotalPar(),
            row.getPlayedDate());
    }

    private static String displayName(LeaderboardRoundRow row) {
        String first = row.getFirstName() != null ? row.getFirstName().trim() : "";
        String last = row.getLastName() != null ? row.getLastName().trim() : "";
        String name = (first + " " + last).trim();
        return name.isEmpty() ? "Unknown Player" : name;
    }
}
