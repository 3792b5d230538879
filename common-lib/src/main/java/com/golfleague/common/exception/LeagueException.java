package com.golfleague.common.exception;

public class LeagueException extends RuntimeException {
    private final String component;

    public LeagueException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public LeagueException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
