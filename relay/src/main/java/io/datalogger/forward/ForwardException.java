package io.datalogger.forward;

/**
 * A batch could not be delivered. {@link #isPermanent()} distinguishes a collector rejection
 * (do not retry) from a transient failure (retry the same records after a backoff).
 */
public class ForwardException extends Exception {
    public static final int NO_STATUS = -1;

    private final boolean permanent;
    private final int statusCode;

    private ForwardException(String message, boolean permanent, int statusCode, Throwable cause) {
        super(message, cause);
        this.permanent = permanent;
        this.statusCode = statusCode;
    }

    public static ForwardException transientFailure(String message, int statusCode, Throwable cause) {
        return new ForwardException(message, false, statusCode, cause);
    }

    public static ForwardException permanentFailure(String message, int statusCode) {
        return new ForwardException(message, true, statusCode, null);
    }

    public boolean isPermanent() { return permanent; }

    /** HTTP status of the failed response, or {@link #NO_STATUS} when no response was received. */
    public int statusCode() { return statusCode; }
}
