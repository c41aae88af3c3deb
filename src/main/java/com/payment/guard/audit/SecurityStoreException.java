package com.payment.guard.audit;

/**
 * Infrastructure failure of a backing store (history, counters). Kept apart from the typed
 * results used for expected outcomes so no caller mistakes an outage for a verdict.
 */
public class SecurityStoreException extends RuntimeException {

    public SecurityStoreException(String message) {
        super(message);
    }

    public SecurityStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
