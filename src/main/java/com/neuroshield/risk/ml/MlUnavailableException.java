package com.neuroshield.risk.ml;

/**
 * The fraud classifier could not produce a verdict: timeout, transport error, non-2xx or unreadable body.
 */
public class MlUnavailableException extends RuntimeException {

    public MlUnavailableException(String message) {
        super(message);
    }

    public MlUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
