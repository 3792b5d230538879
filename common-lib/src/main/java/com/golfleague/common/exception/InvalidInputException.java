package com.golfleague.common.exception;

/**
 * Malformed input handed to a pure calculation (for example hole-score and
 * hole-par arrays of different lengths). Always surfaced to the caller.
 */
public class InvalidInputException extends LeagueException {

    public InvalidInputException(String component, String message) {
        super(component, message);
    }
}
