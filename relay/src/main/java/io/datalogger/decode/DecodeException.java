package io.datalogger.decode;

/**
 * Raised for a payload or topic that can never be turned into a reading. Not retryable.
 */
public class DecodeException extends Exception {
    private final String topic;

    public DecodeException(String topic, String message) {
        super(message);
        this.topic = topic;
    }

    public DecodeException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }

    public String topic() { return topic; }
}
