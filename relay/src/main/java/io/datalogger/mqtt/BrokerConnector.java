package io.datalogger.mqtt;

import java.util.List;

public interface BrokerConnector {
    /**
     * Opens a session and subscribes to every filter at QoS 1. Messages are buffered until a handler
     * is installed with {@link BrokerSession#onMessage(MessageHandler)}.
     */
    BrokerSession connect(BrokerAddress address, Credentials credentials, List<String> topicFilters) throws ConnectionException;
}
