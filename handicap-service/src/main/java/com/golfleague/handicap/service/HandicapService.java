package com.golfleague.handicap.service;

import com.golfleague.common.event.RoundChangePublisher;
import com.golfleague.common.exception.InvalidInputException;
import com.golfleague.common.exception.LeagueException;
import com.golfleague.common.exception.RoundNotFoundException;
import com.golfleague.common.exception.UpstreamErrors;
import com.golfleague.common.handicap.HandicapCalculator;
import com.golfleague.common.model.HandicapCalculationResult;
import com.golfleague.common.model.HandicapPostResult;
import com.golfleague.common.model.RoundChangeEvent;
import com.golfleague.common.model.ScoreDifferentialData;
import com.golfleague.handicap.dto.CourseHandicapDTO;
import com.golfleague.handicap.dto.HandicapHistoryDTO;
import com.golfleague.handicap.dto.PlayerHandicapDTO;
import com.golfleague.handicap.dto.RecalculationSummaryDTO;
import com.golfleague.handicap.model.HandicapHistory;
import com.golfleague.handicap.model.HoleScoreRow;
import com.golfleague.handicap.model.Profile;
import com.golfleague.handicap.model.Round;
import com.golfleague.handicap.model.TeeBox;
import com.golfleague.handicap.repository.CourseRepository;
import com.golfleague.handicap.repository.HandicapHistoryRepository;
import com.golfleague.handicap.repository.HoleScoreRepository;
import com.golfleague.handicap.repository.ProfileRepository;
import com.golfleague.handicap.repository.RoundRepository;
import com.golfleague.handicap.repository.TeeBoxRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns every write to a player's handicap state: posting rounds, the current
 * Handicap Index on the profile, and the handicap history trail.
 *
 * <h3>Concurrent posts for one player</h3>
 * <p>The index write is a compare-and-swap on {@code profiles.handicap_version}.
 * The profile (and its version) is read <em>before</em> the posted rounds, so a
 * recompute that loses the race is rejected and re-run against the newer
 * round set. Different players never contend.
 */
@Service
public class HandicapService {

    private static final Logger log = LoggerFactory.getLogger(HandicapService.class);

    private static final String COMPONENT = "handicap";

    private final RoundRepository roundRepository;
    private final ProfileRepository profileRepository;
    private final HandicapHistoryRepository historyRepository;
    private final TeeBoxRepository teeBoxRepository;
    private final CourseRepository courseRepository;
    private final HoleScoreRepository holeScoreRepository;
    private final RoundChangePublisher changePublisher;
    private final int maxRecomputeAttempts;

    public HandicapService(RoundRepository roundRepository,
                           ProfileRepository profileRepository,
                           HandicapHistoryRepository historyRepository,
                           TeeBoxRepository teeBoxRepository,
                           CourseRepository courseRepository,
                           HoleScoreRepository holeScoreRepository,
                           RoundChangePublisher changePublisher,
                           @Value("${handicap.recompute.max-attempts:3}") int maxRecomputeAttempts) {
        this.roundRepository      = roundRepository;
        this.profileRepository    = profileRepository;
        this.historyRepository    = historyRepository;
        this.teeBoxRepository     = teeBoxRepository;
        this.courseRepository     = courseRepository;
        this.holeScoreRepository  = holeScoreRepository;
        this.changePublisher      = changePublisher;
        this.maxRecomputeAttempts = Math.max(1, maxRecomputeAttempts);
    }

    // ── Posting ─────────────────────────────────────────────────────────────

    /**
     * Posts a round for handicap.
     *
     * <ol>
     *   <li>Course Handicap from the player's stored index (0 when none).</li>
     *   <li>Adjusted Gross Score under ESC using that Course Handicap.</li>
     *   <li>Score Differential; round marked posted with all three figures.</li>
     *   <li>Index recomputed from every posted round and, when one results,
     *       written to the profile and appended to history.</li>
     * </ol>
     *
     * <p>Step 4 is non-fatal: the round stays posted with its differential even
     * when no index can be produced. Ineligible rounds are reported with
     * {@code posted = false}, never as errors.
     */
    public Mono<HandicapPostResult> postRoundForHandicap(String roundIdParam) {
        return Mono.defer(() -> {
            UUID roundId = parseId(roundIdParam, "roundId");
            return guard(roundRepository.findById(roundId), "round " + roundId)
                .switchIfEmpty(Mono.error(() -> new RoundNotFoundException(roundIdParam)))
                .flatMap(round -> loadPostingContext(round)
                    .flatMap(ctx -> post(round, ctx)))
                .doOnError(e -> log.error("Failed to post round for handicap. roundId={}", roundIdParam, e));
        });
    }

    private Mono<PostingContext> loadPostingContext(Round round) {
        Mono<TeeBox> teeBox = guard(teeBoxRepository.findById(round.getTeeBoxId()), "tee box " + round.getTeeBoxId())
            .defaultIfEmpty(new TeeBox());

        Mono<List<HoleScoreRow>> holes = guard(holeScoreRepository.findHoleScores(round.getId()),
                "hole scores for round " + round.getId())
            .collectList();

        Mono<Integer> par = coursePar(round.getCourseId());

        Mono<Double> currentIndex = guard(profileRepository.findById(round.getUserId()), "profile " + round.getUserId())
            .flatMap(p -> Mono.justOrEmpty(p.getCurrentHandicapIndex()))
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.debug("No handicap index established; using 0. userId={}", round.getUserId());
                return 0.0;
            }));

        return Mono.zip(teeBox, holes, par, currentIndex)
            .map(t -> new PostingContext(t.getT1(), t.getT2(), t.getT3(), t.getT4()));
    }

    private Mono<HandicapPostResult> post(Round round, PostingContext ctx) {
        String roundId = round.getId().toString();
        TeeBox tee = ctx.teeBox();

        if (!HandicapCalculator.isRoundEligibleForHandicap(ctx.holes().size(), tee.getCourseRating(), tee.getSlopeRating())) {
            log.info("Round not eligible for handicap. roundId={} holes={} courseRating={} slopeRating={}",
                     roundId, ctx.holes().size(), tee.getCourseRating(), tee.getSlopeRating());
            return Mono.just(HandicapPostResult.ineligible(roundId,
                "Round is not eligible for handicap: 18 holes and valid course/slope ratings are required"));
        }

        int[] strokes = ctx.holes().stream().mapToInt(HoleScoreRow::getStrokes).toArray();
        int[] pars = ctx.holes().stream().mapToInt(HoleScoreRow::getPar).toArray();

        int courseHandicap = HandicapCalculator.computeCourseHandicap(
            ctx.currentIndex(), tee.getSlopeRating(), tee.getCourseRating(), ctx.par());
        int adjusted = HandicapCalculator.computeAdjustedGrossScore(strokes, pars, courseHandicap);
        double differential = HandicapCalculator.computeScoreDifferential(
            adjusted, tee.getCourseRating(), tee.getSlopeRating());

        HandicapPostResult posted = new HandicapPostResult(
            roundId, true, courseHandicap, adjusted, differential, null, "Round posted");

        return guard(roundRepository.markPosted(round.getId(), courseHandicap, adjusted, differential),
                "round update " + roundId)
            .flatMap(updated -> updated > 0
                ? Mono.just(posted)
                : Mono.<HandicapPostResult>error(new RoundNotFoundException(roundId)))
            .doOnSuccess(r -> log.info("Round posted. roundId={} userId={} courseHandicap={} adjusted={} differential={}",
                                       roundId, round.getUserId(), courseHandicap, adjusted, differential))
            .flatMap(r -> recomputeAndStore(round.getUserId(), true)
                .map(update -> r.withHandicapIndex(update.result().handicapIndex(),
                    "Round posted; handicap index updated"))
                .defaultIfEmpty(r.withHandicapIndex(null,
                    "Round posted; at least " + HandicapCalculator.MIN_ROUNDS_FOR_INDEX
                        + " posted rounds are needed for a handicap index"))
                .onErrorResume(e -> {
                    log.warn("Handicap recompute failed (non-fatal). roundId={} userId={}",
                             roundId, round.getUserId(), e);
                    return Mono.just(r.withHandicapIndex(null, "Round posted; handicap index not updated"));
                }))
            .doOnSuccess(r -> publishChange(round));
    }

    // ── Index recompute (CAS-guarded) ───────────────────────────────────────

    /**
     * Recomputes the player's index from all posted rounds and writes it.
     *
     * @param alwaysRecordHistory true to append history even when the value is
     *                            unchanged (posting); false appends only on change
     * @return the update, or empty when fewer than five posted rounds exist
     */
    Mono<IndexUpdate> recomputeAndStore(UUID userId, boolean alwaysRecordHistory) {
        return Mono.defer(() -> guard(profileRepository.findById(userId), "profile " + userId)
                .switchIfEmpty(Mono.error(() -> new LeagueException(COMPONENT, "Profile not found. userId=" + userId)))
                .flatMap(profile -> loadDifferentialData(userId)
                    .flatMap(rounds -> Mono.justOrEmpty(HandicapCalculator.computeHandicapIndex(rounds)))
                    .flatMap(result -> compareAndSet(profile, result))))
            .retryWhen(Retry.max(maxRecomputeAttempts - 1L)
                .filter(e -> e instanceof StaleHandicapVersionException)
                .doBeforeRetry(s -> log.info("Handicap index changed concurrently; recomputing. userId={} attempt={}",
                                             userId, s.totalRetries() + 2)))
            .flatMap(update -> alwaysRecordHistory || update.changed()
                ? appendHistory(userId, update.result()).thenReturn(update)
                : Mono.just(update));
    }

    private Mono<IndexUpdate> compareAndSet(Profile profile, HandicapCalculationResult result) {
        long version = profile.getHandicapVersion() != null ? profile.getHandicapVersion() : 0L;
        return guard(profileRepository.compareAndSetHandicapIndex(profile.getId(), result.handicapIndex(), version),
                "profile update " + profile.getId())
            .flatMap(updated -> {
                if (updated > 0) {
                    log.info("Handicap index updated. userId={} previous={} current={} scoresUsed={}",
                             profile.getId(), profile.getCurrentHandicapIndex(),
                             result.handicapIndex(), result.numberOfScoresUsed());
                    return Mono.just(new IndexUpdate(result, profile.getCurrentHandicapIndex()));
                }
                return Mono.error(new StaleHandicapVersionException(profile.getId(), version));
            });
    }

    private Mono<Void> appendHistory(UUID userId, HandicapCalculationResult result) {
        HandicapHistory entry = new HandicapHistory();
        entry.setUserId(userId);
        entry.setHandicapIndex(result.handicapIndex());
        entry.setCalculatedDate(LocalDate.now(ZoneOffset.UTC));
        entry.setRoundsUsed(result.numberOfScoresUsed());
        entry.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));

        return historyRepository.save(entry)
            .doOnSuccess(h -> log.debug("Handicap history appended. userId={} index={}", userId, result.handicapIndex()))
            .onErrorResume(e -> {
                log.warn("Failed to store handicap history (non-fatal). userId={}", userId, e);
                return Mono.empty();
            })
            .then();
    }

    private Mono<List<ScoreDifferentialData>> loadDifferentialData(UUID userId) {
        return guard(roundRepository.findPostedForHandicap(userId), "posted rounds for player " + userId)
            .filter(row -> row.getAdjustedScore() != null
                && row.getCourseRating() != null
                && row.getSlopeRating() != null
                && row.getSlopeRating() > 0)
            .map(row -> new ScoreDifferentialData(
                row.getAdjustedScore(), row.getCourseRating(), row.getSlopeRating(), row.getPlayedDate()))
            .collectList();
    }

    // ── Queries ─────────────────────────────────────────────────────────────

    /**
     * Index calculated from the player's posted rounds, without writing it.
     * Empty when fewer than five posted rounds exist.
     */
    public Mono<HandicapCalculationResult> calculateUserHandicap(String userIdParam) {
        return Mono.defer(() -> loadDifferentialData(parseId(userIdParam, "userId"))
            .flatMap(rounds -> Mono.justOrEmpty(HandicapCalculator.computeHandicapIndex(rounds))));
    }

    public Mono<PlayerHandicapDTO> getPlayerHandicap(String userId) {
        return calculateUserHandicap(userId)
            .map(r -> new PlayerHandicapDTO(userId, r.handicapIndex(),
                HandicapCalculator.formatHandicapIndex(r.handicapIndex()),
                r.numberOfScoresUsed(), r.averageDifferential(), r.scoresUsed()));
    }

    public Flux<HandicapHistoryDTO> fetchHandicapHistory(String userIdParam, int limit) {
        return Flux.defer(() -> {
            UUID userId = parseId(userIdParam, "userId");
            return guard(historyRepository.findRecentByUserId(userId, Math.max(1, limit)),
                    "handicap history for player " + userId)
                .map(h -> new HandicapHistoryDTO(userIdParam, h.getHandicapIndex(),
                    h.getCalculatedDate(), h.getRoundsUsed()));
        });
    }

    /**
     * Course Handicap the player would receive from a tee box today, based on the
     * stored index. 0 when the player has no index or the tee box has no ratings.
     */
    public Mono<CourseHandicapDTO> getCourseHandicapForTeeBox(String userIdParam, String teeBoxIdParam) {
        return Mono.defer(() -> {
            UUID userId = parseId(userIdParam, "userId");
            UUID teeBoxId = parseId(teeBoxIdParam, "teeBoxId");

            return guard(profileRepository.findById(userId), "profile " + userId)
                .map(p -> Optional.ofNullable(p.getCurrentHandicapIndex()))
                .defaultIfEmpty(Optional.empty())
                .flatMap(index -> {
                    if (index.isEmpty()) {
                        return Mono.just(new CourseHandicapDTO(userIdParam, teeBoxIdParam, null, 0));
                    }
                    double hi = index.get();
                    return guard(teeBoxRepository.findById(teeBoxId), "tee box " + teeBoxId)
                        .filter(box -> box.getCourseRating() != null && box.getSlopeRating() != null)
                        .flatMap(box -> coursePar(box.getCourseId())
                            .map(par -> new CourseHandicapDTO(userIdParam, teeBoxIdParam, hi,
                                HandicapCalculator.computeCourseHandicap(
                                    hi, box.getSlopeRating(), box.getCourseRating(), par))))
                        .defaultIfEmpty(new CourseHandicapDTO(userIdParam, teeBoxIdParam, hi, 0));
                });
        });
    }

    /**
     * Admin-forced recompute for every player, one at a time. A failure for one
     * player is counted and logged; it never aborts the run.
     */
    public Mono<RecalculationSummaryDTO> recalculateAllHandicaps() {
        return guard(profileRepository.findAll(), "profiles")
            .concatMap(profile -> recomputeAndStore(profile.getId(), false)
                .map(update -> Outcome.SUCCESS)
                .defaultIfEmpty(Outcome.SKIPPED)
                .onErrorResume(e -> {
                    log.warn("Failed to recalculate handicap. userId={}", profile.getId(), e);
                    return Mono.just(Outcome.FAILED);
                }))
            .collectList()
            .map(outcomes -> new RecalculationSummaryDTO(
                count(outcomes, Outcome.SUCCESS), count(outcomes, Outcome.FAILED), count(outcomes, Outcome.SKIPPED)))
            .doOnSuccess(s -> log.info("Handicap recalculation complete. success={} failed={} skipped={}",
                                       s.success(), s.failed(), s.skipped()));
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private Mono<Integer> coursePar(UUID courseId) {
        if (courseId == null) return Mono.just(HandicapCalculator.DEFAULT_PAR);
        return guard(courseRepository.findById(courseId), "course " + courseId)
            .flatMap(c -> Mono.justOrEmpty(c.getTotalPar()))
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.warn("Course par missing; assuming {}. courseId={}", HandicapCalculator.DEFAULT_PAR, courseId);
                return HandicapCalculator.DEFAULT_PAR;
            }));
    }

    private void publishChange(Round round) {
        if (round.getEventId() == null) return;
        try {
            changePublisher.publish(RoundChangeEvent.updated(round.getEventId().toString(), round.getId().toString()));
        } catch (RuntimeException e) {
            log.warn("Round change publish failed (non-critical). eventId={} roundId={}",
                     round.getEventId(), round.getId(), e);
        }
    }

    private static UUID parseId(String value, String field) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidInputException(COMPONENT, "Invalid " + field + ": " + value);
        }
    }

    private static <T> Mono<T> guard(Mono<T> source, String what) {
        return UpstreamErrors.guard(source, COMPONENT, what);
    }

    private static <T> Flux<T> guard(Flux<T> source, String what) {
        return UpstreamErrors.guard(source, COMPONENT, what);
    }

    private static int count(List<Outcome> outcomes, Outcome wanted) {
        return (int) outcomes.stream().filter(o -> o == wanted).count();
    }

    private enum Outcome { SUCCESS, FAILED, SKIPPED }

    private record PostingContext(TeeBox teeBox, List<HoleScoreRow> holes, int par, double currentIndex) {}

    record IndexUpdate(HandicapCalculationResult result, Double previousIndex) {

        boolean changed() {
            return previousIndex == null || Double.compare(previousIndex, result.handicapIndex()) != 0;
        }
    }
}
