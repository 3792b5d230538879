package com.golfleague.common.leaderboard;

import com.golfleague.common.model.LeaderboardEntry;
import com.golfleague.common.model.ScoreType;
import com.golfleague.common.model.TeamLeaderboardEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.ToIntFunction;

/**
 * Sorts leaderboard rows ascending by score and assigns positions.
 *
 * <h3>Position rule</h3>
 * <p>Walking the sorted rows, the first row is position 1. A row whose score
 * equals the <em>immediately preceding</em> row's score shares that row's
 * position; any other row takes {@code index + 1} (1-based). Positions
 * therefore skip after a tie group:
 * <pre>
 *   [70, 70, 72]     → [1, 1, 3]
 *   [68, 70, 70, 71] → [1, 2, 2, 4]
 * </pre>
 *
 * <p>The sort is stable, so rows with equal scores keep their input order.
 */
public final class LeaderboardRanker {

    private LeaderboardRanker() {}

    public static List<LeaderboardEntry> rank(List<LeaderboardEntry> entries, ScoreType sortBy) {
        return rank(entries, e -> e.score(sortBy), LeaderboardEntry::withPosition);
    }

    public static List<TeamLeaderboardEntry> rankTeams(List<TeamLeaderboardEntry> entries, ScoreType sortBy) {
        return rank(entries, e -> e.score(sortBy), TeamLeaderboardEntry::withPosition);
    }

    /**
     * @param entries      rows in any order; not modified
     * @param score        score extractor, lower is better
     * @param withPosition copies a row with the given position
     * @return a new list in ranked order
     */
    public static <T> List<T> rank(List<T> entries, ToIntFunction<T> score,
                                   BiFunction<T, Integer, T> withPosition) {
        if (entries == null || entries.isEmpty()) return List.of();

        List<T> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingInt(score));

        int[] scores = new int[sorted.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = score.applyAsInt(sorted.get(i));
        }
        int[] positions = assignPositions(scores);

        List<T> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(withPosition.apply(sorted.get(i), positions[i]));
        }
        return ranked;
    }

    /**
     * Positions for scores already in ascending order.
     */
    public static int[] assignPositions(int[] sortedScores) {
        int[] positions = new int[sortedScores.length];
        int current = 1;
        for (int i = 0; i < sortedScores.length; i++) {
            if (i > 0 && sortedScores[i] != sortedScores[i - 1]) {
                current = i + 1;
            }
            positions[i] = current;
        }
        return positions;
    }
}
