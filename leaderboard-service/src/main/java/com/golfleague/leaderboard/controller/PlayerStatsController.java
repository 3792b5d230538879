package com.golfleague.leaderboard.controller;

import com.golfleague.common.model.PlayerStats;
import com.golfleague.common.model.StatsSummary;
import com.golfleague.leaderboard.service.PlayerStatsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/leaderboard/players")
public class PlayerStatsController {

    private static final Logger log = LoggerFactory.getLogger(PlayerStatsController.class);

    private final PlayerStatsService statsService;

    public PlayerStatsController(PlayerStatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping("/{userId}/stats")
    public Mono<PlayerStats> playerStats(@PathVariable String userId) {
        log.info("Player stats requested. userId={}", userId);
        return statsService.computePlayerStats(userId);
    }

    @GetMapping("/{userId}/stats/summary")
    public Mono<StatsSummary> statsSummary(@PathVariable String userId) {
        log.info("Stats summary requested. userId={}", userId);
        return statsService.computeStatsSummary(userId);
    }
}
