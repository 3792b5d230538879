package com.golfleague.handicap.repository;

import com.golfleague.handicap.model.TeeBox;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface TeeBoxRepository extends ReactiveCrudRepository<TeeBox, UUID> {
}
