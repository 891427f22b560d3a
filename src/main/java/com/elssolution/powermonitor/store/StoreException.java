package com.elssolution.powermonitor.store;

/** Failure talking to the underlying SQLite store. */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
