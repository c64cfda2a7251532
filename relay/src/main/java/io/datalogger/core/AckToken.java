package io.datalogger.core;

/**
 * Opaque handle for one inbound broker message. Only the session that issued a token can
 * acknowledge it; tokens do not survive a restart.
 */
public final class AckToken {
    private final long id;
    private final Object handle;

    public AckToken(long id, Object handle) {
        this.id = id;
        this.handle = handle;
    }

    public long id() { return id; }

    /** Session-specific message handle. */
    public Object handle() { return handle; }

    @Override
    public String toString() {
        return "AckToken{" + id + '}';
    }
}
