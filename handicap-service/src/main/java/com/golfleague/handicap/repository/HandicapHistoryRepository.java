package com.golfleague.handicap.repository;

import com.golfleague.handicap.model.HandicapHistory;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Repository
public interface HandicapHistoryRepository extends ReactiveCrudRepository<HandicapHistory, UUID> {

    @Query("""
        SELECT * FROM handicap_history
        WHERE user_id = :userId
        ORDER BY calculated_date DESC, created_at DESC
        LIMIT :limit
        """)
    Flux<HandicapHistory> findRecentByUserId(UUID userId, int limit);
}
