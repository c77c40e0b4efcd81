package io.rollcron.internal.sync;

/**
 * Failure while mirroring the source of truth or materializing a job directory.
 */
public class SyncException extends RuntimeException {

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
