package com.shlawgathon.pulse.backend.exception;

/**
 * The interaction record store could not be reached or failed a query.
 */
public class RecordStoreUnavailableException extends RuntimeException {

    public RecordStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
