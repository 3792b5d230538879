package com.golfleague.handicap.repository;

import com.golfleague.handicap.model.PostedRoundRow;
import com.golfleague.handicap.model.Round;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface RoundRepository extends ReactiveCrudRepository<Round, UUID> {

    /**
     * All rounds the player has posted for handicap, newest first, each joined
     * with the course and slope rating of its tee box.
     */
    @Query("""
        SELECT r.adjusted_score, t.course_rating, t.slope_rating, r.played_date
        FROM rounds r
        JOIN tee_boxes t ON t.id = r.tee_box_id
        WHERE r.user_id = :userId
          AND r.is_posted_for_handicap = true
        ORDER BY r.played_date DESC
        """)
    Flux<PostedRoundRow> findPostedForHandicap(UUID userId);

    /**
     * Stores the post-time handicap figures and flips the posted flag.
     * Re-posting the same round overwrites the previous figures.
     *
     * @return number of rows updated (0 when the round no longer exists)
     */
    @Modifying
    @Query("""
        UPDATE rounds SET
            course_handicap        = :courseHandicap,
            adjusted_score         = :adjustedScore,
            score_differential     = :scoreDifferential,
            is_posted_for_handicap = true,
            updated_at             = NOW()
        WHERE id = :roundId
        """)
    Mono<Integer> markPosted(UUID roundId, int courseHandicap, int adjustedScore, double scoreDifferential);
}
