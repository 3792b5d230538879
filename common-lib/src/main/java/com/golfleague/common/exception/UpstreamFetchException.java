package com.golfleague.common.exception;

/**
 * The storage collaborator failed to return data. Propagated as-is; no retries
 * are attempted by the core.
 */
public class UpstreamFetchException extends LeagueException {

    public UpstreamFetchException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
