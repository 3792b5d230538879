package com.golfleague.common.handicap;

import com.golfleague.common.model.HandicapCalculationResult;
import com.golfleague.common.model.ScoreDifferentialData;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * World Handicap System calculations used by the league.
 *
 * <h3>Formulas</h3>
 * <pre>
 *   Score Differential = (113 / Slope Rating) × (Adjusted Gross Score − Course Rating)
 *   Course Handicap    = Handicap Index × (Slope Rating / 113) + (Course Rating − Par)
 *   Handicap Index     = average of the best N differentials among the most recent 20
 * </pre>
 *
 * <h3>Rounds to differentials</h3>
 * <pre>
 * Rounds (max 20) | Lowest differentials used
 * 5-6             | 1
 * 7-8             | 2
 * 9-11            | 3
 * 12-14           | 4
 * 15-16           | 5
 * 17-18           | 6
 * 19              | 7
 * 20              | 8
 * </pre>
 *
 * <p>The league publishes the raw average of the best differentials. The 0.96
 * factor of the official rules is not applied.
 *
 * <p>Pure static utility. No Spring dependencies, no I/O.
 */
public final class HandicapCalculator {

    /** Denominator of the slope rating scale (a course of standard difficulty). */
    private static final BigDecimal STANDARD_SLOPE = BigDecimal.valueOf(113);

    public static final int DEFAULT_PAR = 72;

    public static final int MIN_ROUNDS_FOR_INDEX = 5;

    public static final int MAX_RECENT_ROUNDS = 20;

    public static final int HOLES_PER_ROUND = 18;

    private static final double MIN_COURSE_RATING = 60.0;
    private static final double MAX_COURSE_RATING = 80.0;
    private static final int    MIN_SLOPE_RATING  = 55;
    private static final int    MAX_SLOPE_RATING  = 155;

    private HandicapCalculator() {}

    /**
     * Differential for a single round, rounded half-up to one decimal place.
     * Computed in decimal so an exact half always rounds up.
     * The caller guarantees {@code slopeRating > 0}.
     */
    public static double computeScoreDifferential(int adjustedGrossScore, double courseRating, int slopeRating) {
        BigDecimal overRating = BigDecimal.valueOf(adjustedGrossScore).subtract(BigDecimal.valueOf(courseRating));
        return overRating.multiply(STANDARD_SLOPE)
            .divide(BigDecimal.valueOf(slopeRating), MathContext.DECIMAL128)
            .setScale(1, RoundingMode.HALF_UP)
            .doubleValue();
    }

    /**
     * Adjusted gross score under Equitable Stroke Control.
     *
     * @see EquitableStrokeControl#adjustedGrossScore(int[], int[], int)
     */
    public static int computeAdjustedGrossScore(int[] holeStrokes, int[] holePars, int courseHandicap) {
        return EquitableStrokeControl.adjustedGrossScore(holeStrokes, holePars, courseHandicap);
    }

    public static int computeCourseHandicap(double handicapIndex, int slopeRating, double courseRating) {
        return computeCourseHandicap(handicapIndex, slopeRating, courseRating, DEFAULT_PAR);
    }

    /**
     * Strokes received at a tee box, rounded to the nearest integer with halves
     * going away from zero. Not clamped: a plus handicap on an easy course yields
     * a negative value.
     */
    public static int computeCourseHandicap(double handicapIndex, int slopeRating, double courseRating, int par) {
        BigDecimal slopeAdjusted = BigDecimal.valueOf(handicapIndex)
            .multiply(BigDecimal.valueOf(slopeRating))
            .divide(STANDARD_SLOPE, MathContext.DECIMAL128);
        BigDecimal ratingOverPar = BigDecimal.valueOf(courseRating).subtract(BigDecimal.valueOf(par));
        return slopeAdjusted.add(ratingOverPar).setScale(0, RoundingMode.HALF_UP).intValue();
    }

    /**
     * Handicap Index from a player's posted rounds.
     *
     * @param rounds posted rounds in any order; null or fewer than
     *               {@value #MIN_ROUNDS_FOR_INDEX} yields empty
     * @return the calculation, or empty when no index can be established
     */
    public static Optional<HandicapCalculationResult> computeHandicapIndex(List<ScoreDifferentialData> rounds) {
        if (rounds == null || rounds.size() < MIN_ROUNDS_FOR_INDEX) {
            return Optional.empty();
        }

        List<ScoreDifferentialData> recent = new ArrayList<>(rounds);
        recent.sort(Comparator.comparing(ScoreDifferentialData::playedDate,
            Comparator.nullsLast(Comparator.<LocalDate>reverseOrder())));
        if (recent.size() > MAX_RECENT_ROUNDS) {
            recent = new ArrayList<>(recent.subList(0, MAX_RECENT_ROUNDS));
        }

        List<Scored> scored = new ArrayList<>(recent.size());
        for (ScoreDifferentialData round : recent) {
            scored.add(new Scored(round, computeScoreDifferential(
                round.adjustedGrossScore(), round.courseRating(), round.slopeRating())));
        }
        scored.sort(Comparator.comparingDouble(Scored::differential));

        int used = differentialsToUse(scored.size());
        BigDecimal sum = BigDecimal.ZERO;
        List<ScoreDifferentialData> scoresUsed = new ArrayList<>(used);
        for (int i = 0; i < used; i++) {
            sum = sum.add(BigDecimal.valueOf(scored.get(i).differential()));
            scoresUsed.add(scored.get(i).round());
        }
        BigDecimal divisor = BigDecimal.valueOf(used);
        double index = sum.divide(divisor, 1, RoundingMode.HALF_UP).doubleValue();
        double average = sum.divide(divisor, MathContext.DECIMAL64).doubleValue();

        return Optional.of(new HandicapCalculationResult(index, used, List.copyOf(scoresUsed), average));
    }

    /**
     * Number of lowest differentials averaged for {@code roundCount} retained
     * rounds. Counts above {@value #MAX_RECENT_ROUNDS} are treated as 20.
     *
     * @return 0 when {@code roundCount} is below the minimum
     */
    public static int differentialsToUse(int roundCount) {
        if (roundCount < MIN_ROUNDS_FOR_INDEX) return 0;
        if (roundCount <= 6)  return 1;
        if (roundCount <= 8)  return 2;
        if (roundCount <= 11) return 3;
        if (roundCount <= 14) return 4;
        if (roundCount <= 16) return 5;
        if (roundCount <= 18) return 6;
        if (roundCount == 19) return 7;
        return 8;
    }

    /**
     * Pre-check before posting. Returns false (never throws) for anything other
     * than a full 18-hole round with ratings inside the accepted ranges.
     */
    public static boolean isRoundEligibleForHandicap(int numberOfHoles, Double courseRating, Integer slopeRating) {
        if (numberOfHoles != HOLES_PER_ROUND) return false;
        if (courseRating == null || slopeRating == null) return false;
        if (courseRating < MIN_COURSE_RATING || courseRating > MAX_COURSE_RATING) return false;
        return slopeRating >= MIN_SLOPE_RATING && slopeRating <= MAX_SLOPE_RATING;
    }

    public static int computeNetScore(int grossScore, int courseHandicap) {
        return grossScore - courseHandicap;
    }

    /**
     * Display form of an index: {@code "N/A"}, {@code "Scratch"}, {@code "+2.5"}
     * for positive values and the bare magnitude otherwise.
     */
    public static String formatHandicapIndex(Double handicapIndex) {
        if (handicapIndex == null) return "N/A";
        if (handicapIndex == 0.0) return "Scratch";
        String magnitude = BigDecimal.valueOf(Math.abs(handicapIndex))
            .setScale(1, RoundingMode.HALF_UP).toPlainString();
        return handicapIndex > 0 ? "+" + magnitude : magnitude;
    }

    private record Scored(ScoreDifferentialData round, double differential) {}
}
