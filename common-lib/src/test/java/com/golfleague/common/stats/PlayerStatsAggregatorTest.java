package com.golfleague.common.stats;

import com.golfleague.common.model.HoleResult;
import com.golfleague.common.model.PlayerRound;
import com.golfleague.common.model.PlayerStats;
import com.golfleague.common.model.RoundSummary;
import com.golfleague.common.model.ScoreTrend;
import com.golfleague.common.model.ScoringDistribution;
import com.golfleague.common.model.StatsSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlayerStatsAggregatorTest {

    private static final LocalDate START = LocalDate.of(2025, 4, 1);

    private static PlayerRound round(int score, int daysAfterStart, String course) {
        return new PlayerRound("r" + daysAfterStart, score, course, START.plusDays(daysAfterStart));
    }

    /** Scores given newest first; one round per day, the newest on the latest day. */
    private static List<PlayerRound> newestFirst(int... scores) {
        List<PlayerRound> rounds = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            rounds.add(round(scores[i], scores.length - i, "Pine Valley"));
        }
        return rounds;
    }

    @Nested
    @DisplayName("computeStats()")
    class StatsTests {

        @Test
        @DisplayName("no rounds → all zeros, no best round, empty form")
        void noRounds() {
            PlayerStats stats = PlayerStatsAggregator.computeStats(List.of(), List.of());

            assertEquals(0, stats.totalRounds());
            assertEquals(0.0, stats.averageScore());
            assertEquals(0, stats.lowestScore());
            assertEquals(0, stats.highestScore());
            assertNull(stats.bestRound());
            assertEquals(ScoringDistribution.EMPTY, stats.scoringAverages());
            assertTrue(stats.recentForm().isEmpty());
        }

        @Test
        @DisplayName("scores [80, 85, 90] → average 85.0, low 80, high 90")
        void basicFigures() {
            PlayerStats stats = PlayerStatsAggregator.computeStats(newestFirst(80, 85, 90), List.of());

            assertEquals(3, stats.totalRounds());
            assertEquals(85.0, stats.averageScore());
            assertEquals(80, stats.lowestScore());
            assertEquals(90, stats.highestScore());
        }

        @Test
        @DisplayName("average rounds to one decimal, half up: [80, 81, 81, 81] → 80.8")
        void averageRounding() {
            PlayerStats stats = PlayerStatsAggregator.computeStats(newestFirst(80, 81, 81, 81), List.of());

            assertEquals(80.8, stats.averageScore());
        }

        @Test
        @DisplayName("tied lowest score → best round is the most recent of them")
        void bestRoundIsNewestOfTies() {
            List<PlayerRound> rounds = List.of(
                round(78, 1, "Old Course"),
                round(78, 9, "New Course"),
                round(84, 12, "Links"));

            RoundSummary best = PlayerStatsAggregator.computeStats(rounds, List.of()).bestRound();

            assertEquals(78, best.score());
            assertEquals("New Course", best.courseName());
            assertEquals(START.plusDays(9), best.date());
        }

        @Test
        @DisplayName("missing course name → \"Unknown\"")
        void unknownCourse() {
            PlayerStats stats = PlayerStatsAggregator.computeStats(List.of(round(88, 1, null)), List.of());

            assertEquals("Unknown", stats.bestRound().courseName());
            assertEquals("Unknown", stats.recentForm().get(0).courseName());
        }

        @Test
        @DisplayName("recent form → five newest rounds, newest first, whatever the input order")
        void recentFormNewestFive() {
            List<PlayerRound> rounds = new ArrayList<>();
            for (int day = 1; day <= 7; day++) {
                rounds.add(round(70 + day, day, "Pine Valley"));
            }

            List<RoundSummary> form = PlayerStatsAggregator.computeStats(rounds, List.of()).recentForm();

            assertEquals(List.of(77, 76, 75, 74, 73), form.stream().map(RoundSummary::score).toList());
        }
    }

    @Nested
    @DisplayName("distribution()")
    class DistributionTests {

        @Test
        @DisplayName("strokes relative to par land in the matching bucket")
        void buckets() {
            ScoringDistribution d = PlayerStatsAggregator.distribution(List.of(
                new HoleResult(1, 4),   // -3 counts as eagle
                new HoleResult(3, 5),
                new HoleResult(3, 4),
                new HoleResult(4, 4),
                new HoleResult(3, 3),
                new HoleResult(5, 4),
                new HoleResult(6, 4),
                new HoleResult(7, 4),
                new HoleResult(9, 3)));

            assertEquals(new ScoringDistribution(2, 1, 2, 1, 1, 2), d);
            assertEquals(9, d.totalHoles());
        }

        @Test
        void nullHolesIsEmpty() {
            assertEquals(ScoringDistribution.EMPTY, PlayerStatsAggregator.distribution(null));
        }
    }

    @Nested
    @DisplayName("computeSummary()")
    class SummaryTests {

        @Test
        void noRoundsIsStable() {
            assertEquals(StatsSummary.empty(), PlayerStatsAggregator.computeSummary(List.of()));
        }

        @Test
        @DisplayName("fewer than 10 rounds → stable regardless of scores")
        void shortHistoryIsStable() {
            StatsSummary summary = PlayerStatsAggregator.computeSummary(
                newestFirst(70, 70, 70, 70, 70, 95, 95, 95, 95));

            assertEquals(ScoreTrend.STABLE, summary.trend());
            assertEquals(9, summary.totalRounds());
            assertEquals(70, summary.lowestScore());
        }

        @Test
        @DisplayName("recent five more than a stroke lower → up")
        void improvingIsUp() {
            StatsSummary summary = PlayerStatsAggregator.computeSummary(
                newestFirst(80, 80, 80, 80, 80, 82, 82, 82, 82, 82));

            assertEquals(ScoreTrend.UP, summary.trend());
            assertEquals(81.0, summary.averageScore());
        }

        @Test
        @DisplayName("recent five more than a stroke higher → down")
        void worseningIsDown() {
            StatsSummary summary = PlayerStatsAggregator.computeSummary(
                newestFirst(84, 84, 84, 84, 84, 82, 82, 82, 82, 82));

            assertEquals(ScoreTrend.DOWN, summary.trend());
        }

        @Test
        @DisplayName("exactly one stroke apart → stable")
        void oneStrokeIsStable() {
            StatsSummary summary = PlayerStatsAggregator.computeSummary(
                newestFirst(81, 81, 81, 81, 81, 82, 82, 82, 82, 82));

            assertEquals(ScoreTrend.STABLE, summary.trend());
        }

        @Test
        @DisplayName("only the newest 20 rounds count")
        void windowIsTwentyRounds() {
            int[] scores = new int[25];
            for (int i = 0; i < 25; i++) scores[i] = i < 20 ? 90 : 70;

            StatsSummary summary = PlayerStatsAggregator.computeSummary(newestFirst(scores));

            assertEquals(20, summary.totalRounds());
            assertEquals(90, summary.lowestScore());
            assertEquals(90.0, summary.averageScore());
        }
    }
}
