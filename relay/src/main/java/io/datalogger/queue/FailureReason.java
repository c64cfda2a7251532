package io.datalogger.queue;

/**
 * Why a forwarding attempt failed. Permanent failures go straight to the dead-letter store.
 */
public record FailureReason(String message, boolean permanent) {
    public static FailureReason transientFailure(String message) { return new FailureReason(message, false); }
    public static FailureReason permanentFailure(String message) { return new FailureReason(message, true); }
}
