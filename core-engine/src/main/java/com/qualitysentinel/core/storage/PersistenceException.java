package com.qualitysentinel.core.storage;

/**
 * A store call failed, timed out or was interrupted.
 *
 * <p>
 * Always propagated to the caller. Detection aborts on this exception rather
 * than reporting "no anomaly". No retry is attempted here.
 * </p>
 *
 * @since 1.0.0
 */
public class PersistenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
