package com.golfleague.handicap.repository;

import com.golfleague.handicap.model.Profile;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface ProfileRepository extends ReactiveCrudRepository<Profile, UUID> {

    /**
     * Compare-and-swap write of the player's Handicap Index. Succeeds only if
     * nobody has written the index since {@code expectedVersion} was read.
     *
     * @return 1 on success, 0 when the version moved on (caller must recompute)
     */
    @Modifying
    @Query("""
        UPDATE profiles SET
            current_handicap_index = :handicapIndex,
            handicap_version       = handicap_version + 1,
            updated_at             = NOW()
        WHERE id = :userId
          AND handicap_version = :expectedVersion
        """)
    Mono<Integer> compareAndSetHandicapIndex(UUID userId, double handicapIndex, long expectedVersion);
}
