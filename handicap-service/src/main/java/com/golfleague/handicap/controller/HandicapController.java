package com.golfleague.handicap.controller;

import com.golfleague.common.exception.InvalidInputException;
import com.golfleague.common.handicap.HandicapCalculator;
import com.golfleague.common.model.HandicapPostResult;
import com.golfleague.handicap.dto.CourseHandicapDTO;
import com.golfleague.handicap.dto.HandicapHistoryDTO;
import com.golfleague.handicap.dto.PlayerHandicapDTO;
import com.golfleague.handicap.dto.RecalculationSummaryDTO;
import com.golfleague.handicap.service.HandicapService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/handicap")
public class HandicapController {

    private static final Logger log = LoggerFactory.getLogger(HandicapController.class);

    private final HandicapService handicapService;

    public HandicapController(HandicapService handicapService) {
        this.handicapService = handicapService;
    }

    @PostMapping("/rounds/{roundId}/post")
    public Mono<ResponseEntity<HandicapPostResult>> postRound(@PathVariable String roundId) {
        log.info("Post-for-handicap request received. roundId={}", roundId);
        return handicapService.postRoundForHandicap(roundId)
            .map(ResponseEntity::ok);
    }

    /** 204 when the player has fewer than five posted rounds. */
    @GetMapping("/players/{userId}")
    public Mono<ResponseEntity<PlayerHandicapDTO>> playerHandicap(@PathVariable String userId) {
        log.info("Handicap query received. userId={}", userId);
        return handicapService.getPlayerHandicap(userId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    @GetMapping("/players/{userId}/history")
    public Flux<HandicapHistoryDTO> history(@PathVariable String userId,
                                            @RequestParam(defaultValue = "30") int limit) {
        log.info("Handicap history query received. userId={} limit={}", userId, limit);
        return handicapService.fetchHandicapHistory(userId, limit);
    }

    @GetMapping("/players/{userId}/course-handicap")
    public Mono<ResponseEntity<CourseHandicapDTO>> courseHandicapForTeeBox(@PathVariable String userId,
                                                                         @RequestParam String teeBoxId) {
        log.info("Course handicap query received. userId={} teeBoxId={}", userId, teeBoxId);
        return handicapService.getCourseHandicapForTeeBox(userId, teeBoxId)
            .map(ResponseEntity::ok);
    }

    /** Stateless course handicap calculator used by the course set-up screens. */
    @GetMapping("/course-handicap")
    public ResponseEntity<Map<String, Integer>> previewCourseHandicap(@RequestParam double index,
                                                                      @RequestParam int slope,
                                                                      @RequestParam double rating,
                                                                      @RequestParam(defaultValue = "72") int par) {
        if (slope <= 0) {
            throw new InvalidInputException("handicap", "slope must be positive: " + slope);
        }
        int courseHandicap = HandicapCalculator.computeCourseHandicap(index, slope, rating, par);
        return ResponseEntity.ok(Map.of("courseHandicap", courseHandicap));
    }

    @PostMapping("/recalculate")
    public Mono<ResponseEntity<RecalculationSummaryDTO>> recalculateAll() {
        log.info("Handicap recalculation requested for all players");
        return handicapService.recalculateAllHandicaps()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Recalculation endpoint error", e));
    }
}
