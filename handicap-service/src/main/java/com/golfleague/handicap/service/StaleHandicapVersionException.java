package com.golfleague.handicap.service;

import com.golfleague.common.exception.LeagueException;

import java.util.UUID;

/**
 * Another recompute wrote the player's index after this one read the profile.
 * Signals {@link HandicapService} to re-read and recompute.
 */
public class StaleHandicapVersionException extends LeagueException {

    public StaleHandicapVersionException(UUID userId, long expectedVersion) {
        super("handicap", "Handicap index changed concurrently. userId=" + userId
            + " expectedVersion=" + expectedVersion);
    }
}
