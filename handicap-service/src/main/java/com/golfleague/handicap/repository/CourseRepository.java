package com.golfleague.handicap.repository;

import com.golfleague.handicap.model.Course;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CourseRepository extends ReactiveCrudRepository<Course, UUID> {
}
