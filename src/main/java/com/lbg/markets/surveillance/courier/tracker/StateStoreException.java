package com.lbg.markets.surveillance.courier.tracker;

/**
 * Persisted state could not be read or written.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
