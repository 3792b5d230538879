package com.golfleague.common.exception;

public class RoundNotFoundException extends LeagueException {

    private final String roundId;

    public RoundNotFoundException(String roundId) {
        super("handicap", "Round not found. roundId=" + roundId);
        this.roundId = roundId;
    }

    public String getRoundId() {
        return roundId;
    }
}
