package io.datalogger.mqtt;

/**
 * The broker could not be reached or refused the connection.
 */
public class ConnectionException extends Exception {
    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
