package com.golfleague.leaderboard.controller;

import com.golfleague.common.model.LeaderboardEntry;
import com.golfleague.common.model.RoundChangeEvent;
import com.golfleague.common.model.ScoreType;
import com.golfleague.common.model.TeamLeaderboardEntry;
import com.golfleague.leaderboard.service.LeaderboardService;
import com.golfleague.leaderboard.service.LeaderboardStreamService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/leaderboard")
public class LeaderboardController {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardController.class);

    private final LeaderboardService leaderboardService;
    private final LeaderboardStreamService streamService;

    public LeaderboardController(LeaderboardService leaderboardService, LeaderboardStreamService streamService) {
        this.leaderboardService = leaderboardService;
        this.streamService = streamService;
    }

    @GetMapping("/events/{eventId}")
    public Mono<List<LeaderboardEntry>> eventLeaderboard(@PathVariable String eventId,
                                                         @RequestParam(required = false) String sortBy) {
        ScoreType type = ScoreType.fromParam(sortBy);
        log.info("Event leaderboard requested. eventId={} sortBy={}", eventId, type);
        return leaderboardService.computeEventLeaderboard(eventId, type);
    }

    @GetMapping("/events/{eventId}/teams")
    public Mono<List<TeamLeaderboardEntry>> teamLeaderboard(@PathVariable String eventId,
                                                            @RequestParam(required = false) String sortBy) {
        ScoreType type = ScoreType.fromParam(sortBy);
        log.info("Team leaderboard requested. eventId={} sortBy={}", eventId, type);
        return leaderboardService.computeTeamLeaderboard(eventId, type);
    }

    @GetMapping("/season")
    public Mono<List<LeaderboardEntry>> seasonStandings(@RequestParam(required = false) Integer year,
                                                        @RequestParam(required = false) String sortBy,
                                                        @RequestParam(defaultValue = "50") int limit) {
        ScoreType type = ScoreType.fromParam(sortBy);
        log.info("Season standings requested. year={} sortBy={} limit={}", year, type, limit);
        return leaderboardService.computeSeasonStandings(year, type, limit);
    }

    /**
     * Change signal for an event's rounds. The body is optional so a plain
     * database change hook can call this without a payload.
     */
    @PostMapping("/events/{eventId}/changes")
    public ResponseEntity<Void> roundChanged(@PathVariable String eventId,
                                             @RequestBody(required = false) RoundChangeEvent change) {
        String canonicalId = leaderboardService.parseEventId(eventId).toString();
        RoundChangeEvent event = change == null
            ? new RoundChangeEvent(canonicalId, null, "UPDATE", Instant.now())
            : new RoundChangeEvent(canonicalId, change.roundId(), change.changeType(),
                change.occurredAt() != null ? change.occurredAt() : Instant.now());
        streamService.publishChange(event);
        return ResponseEntity.accepted().build();
    }

    @GetMapping(value = "/events/{eventId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<List<LeaderboardEntry>>> stream(@PathVariable String eventId,
                                                                @RequestParam(required = false) String sortBy) {
        ScoreType type = ScoreType.fromParam(sortBy);
        log.info("Live leaderboard client connected. eventId={} sortBy={}", eventId, type);
        return streamService.stream(eventId, type)
            .map(entries -> ServerSentEvent.<List<LeaderboardEntry>>builder()
                .event("leaderboard")
                .data(entries)
                .build());
    }
}
