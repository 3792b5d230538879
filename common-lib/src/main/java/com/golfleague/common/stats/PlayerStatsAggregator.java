package com.golfleague.common.stats;

import com.golfleague.common.model.HoleResult;
import com.golfleague.common.model.PlayerRound;
import com.golfleague.common.model.PlayerStats;
import com.golfleague.common.model.RoundSummary;
import com.golfleague.common.model.ScoreTrend;
import com.golfleague.common.model.ScoringDistribution;
import com.golfleague.common.model.StatsSummary;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Player statistics from already-fetched rounds and hole scores.
 *
 * <p>Rounds are considered newest first by played date; rounds sharing a date
 * keep the order they were supplied in. Averages are rounded to one decimal,
 * halves away from zero.
 *
 * <p>Pure static utility. Storage access and logging live in leaderboard-service.
 */
public final class PlayerStatsAggregator {

    public static final int RECENT_FORM_ROUNDS = 5;
    public static final int SUMMARY_WINDOW = 20;
    public static final String UNKNOWN_COURSE = "Unknown";

    /** Rounds needed before a trend is reported: two blocks of {@value #TREND_BLOCK}. */
    public static final int TREND_MIN_ROUNDS = 10;
    private static final int TREND_BLOCK = 5;
    private static final BigDecimal TREND_THRESHOLD = BigDecimal.ONE;

    private PlayerStatsAggregator() {}

    public static PlayerStats computeStats(List<PlayerRound> rounds, List<HoleResult> holes) {
        if (rounds == null || rounds.isEmpty()) return PlayerStats.empty();

        List<PlayerRound> newestFirst = newestFirst(rounds);
        int lowest = Integer.MAX_VALUE;
        int highest = Integer.MIN_VALUE;
        for (PlayerRound round : newestFirst) {
            lowest = Math.min(lowest, round.score());
            highest = Math.max(highest, round.score());
        }

        RoundSummary best = null;
        for (PlayerRound round : newestFirst) {
            if (round.score() == lowest) {
                best = summarize(round);
                break;
            }
        }

        List<RoundSummary> recentForm = newestFirst.stream()
            .limit(RECENT_FORM_ROUNDS)
            .map(PlayerStatsAggregator::summarize)
            .toList();

        return new PlayerStats(
            newestFirst.size(),
            averageOneDecimal(newestFirst),
            lowest,
            highest,
            best,
            distribution(holes),
            recentForm);
    }

    /**
     * Summary over the newest {@value #SUMMARY_WINDOW} rounds. With at least
     * {@value #TREND_MIN_ROUNDS} of them, the five newest are compared with the
     * five before: more than one stroke lower is {@link ScoreTrend#UP}, more than
     * one stroke higher is {@link ScoreTrend#DOWN}.
     */
    public static StatsSummary computeSummary(List<PlayerRound> rounds) {
        if (rounds == null || rounds.isEmpty()) return StatsSummary.empty();

        List<PlayerRound> window = newestFirst(rounds);
        if (window.size() > SUMMARY_WINDOW) {
            window = window.subList(0, SUMMARY_WINDOW);
        }
        int lowest = window.stream().mapToInt(PlayerRound::score).min().orElse(0);

        ScoreTrend trend = ScoreTrend.STABLE;
        if (window.size() >= TREND_MIN_ROUNDS) {
            BigDecimal recent = blockAverage(window.subList(0, TREND_BLOCK));
            BigDecimal previous = blockAverage(window.subList(TREND_BLOCK, 2 * TREND_BLOCK));
            if (recent.compareTo(previous.subtract(TREND_THRESHOLD)) < 0) {
                trend = ScoreTrend.UP;
            } else if (recent.compareTo(previous.add(TREND_THRESHOLD)) > 0) {
                trend = ScoreTrend.DOWN;
            }
        }
        return new StatsSummary(window.size(), averageOneDecimal(window), lowest, trend);
    }

    /**
     * Buckets every hole by strokes relative to par. Empty or null input gives
     * {@link ScoringDistribution#EMPTY}.
     */
    public static ScoringDistribution distribution(List<HoleResult> holes) {
        if (holes == null || holes.isEmpty()) return ScoringDistribution.EMPTY;

        int eagles = 0, birdies = 0, pars = 0, bogeys = 0, doubles = 0, worse = 0;
        for (HoleResult hole : holes) {
            int diff = hole.relativeToPar();
            if (diff <= -2) eagles++;
            else if (diff == -1) birdies++;
            else if (diff == 0) pars++;
            else if (diff == 1) bogeys++;
            else if (diff == 2) doubles++;
            else worse++;
        }
        return new ScoringDistribution(eagles, birdies, pars, bogeys, doubles, worse);
    }

    private static List<PlayerRound> newestFirst(List<PlayerRound> rounds) {
        List<PlayerRound> sorted = new ArrayList<>(rounds);
        sorted.sort(Comparator.comparing(PlayerRound::playedDate,
            Comparator.nullsLast(Comparator.reverseOrder())));
        return sorted;
    }

    private static RoundSummary summarize(PlayerRound round) {
        String course = round.courseName() != null && !round.courseName().isBlank()
            ? round.courseName()
            : UNKNOWN_COURSE;
        return new RoundSummary(round.playedDate(), round.score(), course);
    }

    private static double averageOneDecimal(List<PlayerRound> rounds) {
        return sum(rounds).divide(BigDecimal.valueOf(rounds.size()), 1, RoundingMode.HALF_UP).doubleValue();
    }

    private static BigDecimal blockAverage(List<PlayerRound> rounds) {
        return sum(rounds).divide(BigDecimal.valueOf(rounds.size()), 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal sum(List<PlayerRound> rounds) {
        long total = 0;
        for (PlayerRound round : rounds) total += round.score();
        return BigDecimal.valueOf(total);
    }
}
