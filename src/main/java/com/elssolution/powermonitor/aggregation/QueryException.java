package com.elssolution.powermonitor.aggregation;

import lombok.Getter;

/** A query the caller got wrong. Never retried internally. */
@Getter
public class QueryException extends RuntimeException {

    public enum Reason { UNKNOWN_DEVICE, BAD_RANGE, BAD_RESOLUTION, BAD_LIMIT }

    private final Reason reason;

    public QueryException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
