package io.datalogger.aqi;

/**
 * The AQI.in API refused a request or answered with something unusable.
 */
public class AqiApiException extends Exception {
    private final int statusCode;

    public AqiApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /** HTTP status, or -1 when the failure was not an HTTP status. */
    public int statusCode() { return statusCode; }
}
