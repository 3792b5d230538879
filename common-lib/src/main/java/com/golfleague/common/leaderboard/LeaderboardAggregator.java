package com.golfleague.common.leaderboard;

import com.golfleague.common.handicap.HandicapCalculator;
import com.golfleague.common.model.LeaderboardEntry;
import com.golfleague.common.model.RoundScore;
import com.golfleague.common.model.ScoreType;
import com.golfleague.common.model.TeamLeaderboardEntry;
import com.golfleague.common.model.TeamMemberScore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds ranked leaderboards from already-fetched rounds.
 *
 * <p>Net score is always {@code gross − courseHandicap}, where the course
 * handicap is the snapshot stored on the round when it was posted. A missing
 * snapshot counts as 0 and a missing course par as
 * {@value HandicapCalculator#DEFAULT_PAR}; neither fails the computation.
 *
 * <p>Pure static utility. Storage access and logging live in leaderboard-service.
 */
public final class LeaderboardAggregator {

    private LeaderboardAggregator() {}

    /**
     * One entry per round, ranked by {@code sortBy}. Empty input yields an empty list.
     */
    public static List<LeaderboardEntry> computeEventLeaderboard(List<RoundScore> rounds, ScoreType sortBy) {
        if (rounds == null || rounds.isEmpty()) return List.of();

        List<LeaderboardEntry> entries = new ArrayList<>(rounds.size());
        for (RoundScore round : rounds) {
            int courseHandicap = round.courseHandicap() != null ? round.courseHandicap() : 0;
            int par = round.coursePar() != null ? round.coursePar() : HandicapCalculator.DEFAULT_PAR;
            entries.add(new LeaderboardEntry(
                round.userId(),
                round.userName(),
                round.grossScore(),
                HandicapCalculator.computeNetScore(round.grossScore(), courseHandicap),
                courseHandicap,
                round.handicapIndex(),
                0,
                round.roundId(),
                null,
                round.grossScore() - par));
        }
        return LeaderboardRanker.rank(entries, sortBy);
    }

    /**
     * Per-player averages across {@code rounds}, ranked on the full set and only
     * then truncated to {@code limit}; truncation never renumbers positions.
     */
    public static List<LeaderboardEntry> computeSeasonStandings(List<RoundScore> rounds, ScoreType sortBy, int limit) {
        List<LeaderboardEntry> ranked = LeaderboardRanker.rank(averagePerPlayer(rounds), sortBy);
        if (limit < 0 || ranked.size() <= limit) return ranked;
        return List.copyOf(ranked.subList(0, limit));
    }

    /**
     * Reduces rounds to one unranked entry per player, in first-seen order.
     * Gross and net averages are rounded half-up to integers and {@code thru}
     * carries the number of rounds averaged.
     */
    public static List<LeaderboardEntry> averagePerPlayer(List<RoundScore> rounds) {
        if (rounds == null || rounds.isEmpty()) return List.of();

        Map<String, PlayerTotals> totals = new LinkedHashMap<>();
        for (RoundScore round : rounds) {
            int courseHandicap = round.courseHandicap() != null ? round.courseHandicap() : 0;
            int net = HandicapCalculator.computeNetScore(round.grossScore(), courseHandicap);
            totals.computeIfAbsent(round.userId(),
                    id -> new PlayerTotals(id, round.userName(), round.handicapIndex()))
                .add(round.grossScore(), net);
        }

        List<LeaderboardEntry> entries = new ArrayList<>(totals.size());
        for (PlayerTotals t : totals.values()) {
            entries.add(new LeaderboardEntry(
                t.userId,
                t.userName,
                roundedAverage(t.totalGross, t.roundCount),
                roundedAverage(t.totalNet, t.roundCount),
                0,
                t.handicapIndex,
                0,
                null,
                t.roundCount,
                null));
        }
        return entries;
    }

    /**
     * Team totals for one event: member gross and net scores summed per team,
     * ranked with the same position rule as individual leaderboards.
     */
    public static List<TeamLeaderboardEntry> computeTeamLeaderboard(List<TeamMemberScore> scores, ScoreType sortBy) {
        if (scores == null || scores.isEmpty()) return List.of();

        Map<String, int[]> sums = new LinkedHashMap<>();
        Map<String, String> names = new LinkedHashMap<>();
        for (TeamMemberScore s : scores) {
            int courseHandicap = s.courseHandicap() != null ? s.courseHandicap() : 0;
            int[] acc = sums.computeIfAbsent(s.teamId(), id -> new int[3]);
            acc[0] += s.grossScore();
            acc[1] += HandicapCalculator.computeNetScore(s.grossScore(), courseHandicap);
            acc[2]++;
            names.putIfAbsent(s.teamId(), s.teamName());
        }

        List<TeamLeaderboardEntry> entries = new ArrayList<>(sums.size());
        sums.forEach((teamId, acc) ->
            entries.add(new TeamLeaderboardEntry(teamId, names.get(teamId), acc[0], acc[1], acc[2], 0)));
        return LeaderboardRanker.rankTeams(entries, sortBy);
    }

    private static int roundedAverage(long total, int count) {
        return (int) Math.round((double) total / count);
    }

    private static final class PlayerTotals {
        private final String userId;
        private final String userName;
        private final Double handicapIndex;
        private long totalGross;
        private long totalNet;
        private int roundCount;

        private PlayerTotals(String userId, String userName, Double handicapIndex) {
            this.userId = userId;
            this.userName = userName;
            this.handicapIndex = handicapIndex;
        }

        private void add(int gross, int net) {
            totalGross += gross;
            totalNet += net;
            roundCount++;
        }
    }
}
