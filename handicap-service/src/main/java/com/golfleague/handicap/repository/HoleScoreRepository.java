package com.golfleague.handicap.repository;

import com.golfleague.handicap.model.HoleScore;
import com.golfleague.handicap.model.HoleScoreRow;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Repository
public interface HoleScoreRepository extends ReactiveCrudRepository<HoleScore, UUID> {

    /**
     * Hole-by-hole strokes of a round with each hole's par, in hole order.
     */
    @Query("""
        SELECT h.hole_number, s.strokes, h.par
        FROM scores s
        JOIN holes h ON h.id = s.hole_id
        WHERE s.round_id = :roundId
        ORDER BY h.hole_number ASC
        """)
    Flux<HoleScoreRow> findHoleScores(UUID roundId);
}
