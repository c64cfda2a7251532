package io.datalogger.mqtt;

public record BrokerAddress(String host, int port, String clientId) {
    public BrokerAddress {
        if (host == null || host.isBlank()) throw new IllegalArgumentException("broker host is required");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("invalid broker port " + port);
        if (clientId == null || clientId.isBlank()) throw new IllegalArgumentException("client id is required");
    }

    @Override
    public String toString() { return host + ":" + port + " as " + clientId; }
}
