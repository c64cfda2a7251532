package io.datalogger.queue;

/**
 * The queue's backing store failed. An enqueue that throws this did not persist the reading.
 */
public class QueueStorageException extends RuntimeException {
    public QueueStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
