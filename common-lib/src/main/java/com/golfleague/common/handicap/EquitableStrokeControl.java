package com.golfleague.common.handicap;

import com.golfleague.common.exception.InvalidInputException;

/**
 * Equitable Stroke Control: the most strokes a player may count on a hole,
 * given their Course Handicap.
 *
 * <pre>
 * Course Handicap | Maximum hole score
 * 9 or less       | par + 2 (double bogey)
 * 10-19           | 7
 * 20-29           | 8
 * 30-39           | 9
 * 40+             | 10
 * </pre>
 *
 * <p>Pure static utility, no state.
 */
public final class EquitableStrokeControl {

    private EquitableStrokeControl() {}

    /**
     * @param par            the hole's par
     * @param courseHandicap the player's Course Handicap (may be negative)
     * @return the per-hole cap
     */
    public static int maxHoleScore(int par, int courseHandicap) {
        if (courseHandicap <= 9)  return par + 2;
        if (courseHandicap <= 19) return 7;
        if (courseHandicap <= 29) return 8;
        if (courseHandicap <= 39) return 9;
        return 10;
    }

    /**
     * Sums {@code min(strokes[i], cap[i])} over all holes.
     *
     * @throws InvalidInputException if the two arrays differ in length
     */
    public static int adjustedGrossScore(int[] holeStrokes, int[] holePars, int courseHandicap) {
        if (holeStrokes == null || holePars == null) {
            throw new InvalidInputException("esc", "Hole scores and pars must both be present");
        }
        if (holeStrokes.length != holePars.length) {
            throw new InvalidInputException("esc",
                "Hole scores and pars arrays must have the same length. scores="
                    + holeStrokes.length + " pars=" + holePars.length);
        }
        int total = 0;
        for (int i = 0; i < holeStrokes.length; i++) {
            total += Math.min(holeStrokes[i], maxHoleScore(holePars[i], courseHandicap));
        }
        return total;
    }
}
