package io.datalogger.mqtt;

import io.datalogger.core.AckToken;

import java.util.List;

/**
 * One logical broker session. Survives transport reconnects; ends only with {@link #close()}.
 */
public interface BrokerSession extends AutoCloseable {
    /** Installs the handler that receives every inbound publish. Must be set before messages flow. */
    void onMessage(MessageHandler handler);

    /** Completes the broker's delivery contract for one message. */
    void acknowledge(AckToken token);

    boolean isConnected();

    List<String> topicFilters();

    @Override
    void close();
}
