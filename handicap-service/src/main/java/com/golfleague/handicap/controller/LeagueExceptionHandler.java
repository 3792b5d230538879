package com.golfleague.handicap.controller;

import com.golfleague.common.exception.InvalidInputException;
import com.golfleague.common.exception.LeagueException;
import com.golfleague.common.exception.RoundNotFoundException;
import com.golfleague.common.exception.UpstreamFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Renders league exceptions as {@code {error, message}} bodies.
 */
@RestControllerAdvice
public class LeagueExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LeagueExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Map<String, String>> handleInvalidInput(InvalidInputException e) {
        log.warn("Invalid input. component={} message={}", e.getComponent(), e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "INVALID_INPUT", e);
    }

    @ExceptionHandler(RoundNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleRoundNotFound(RoundNotFoundException e) {
        log.info("Round not found. roundId={}", e.getRoundId());
        return body(HttpStatus.NOT_FOUND, "ROUND_NOT_FOUND", e);
    }

    @ExceptionHandler(UpstreamFetchException.class)
    public ResponseEntity<Map<String, String>> handleUpstream(UpstreamFetchException e) {
        log.error("Upstream fetch failed. component={}", e.getComponent(), e);
        return body(HttpStatus.BAD_GATEWAY, "UPSTREAM_FETCH_FAILED", e);
    }

    @ExceptionHandler(LeagueException.class)
    public ResponseEntity<Map<String, String>> handleLeague(LeagueException e) {
        log.error("Unhandled league error. component={}", e.getComponent(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "LEAGUE_ERROR", e);
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, LeagueException e) {
        return ResponseEntity.status(status).body(Map.of("error", error, "message", e.getMessage()));
    }
}
