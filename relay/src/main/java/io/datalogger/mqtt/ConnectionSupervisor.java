package io.datalogger.mqtt;

import io.datalogger.retry.RetryPolicy;
import io.datalogger.retry.RetryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Keeps trying to open the initial broker session. Connection failures are never fatal; only
 * an interrupt or a policy that gives up ends the loop.
 */
public class ConnectionSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final BrokerConnector connector;
    private final RetryPolicy policy;

    public ConnectionSupervisor(BrokerConnector connector, RetryPolicy policy) {
        this.connector = connector;
        this.policy = policy;
    }

    public BrokerSession connectWithRetry(BrokerAddress address, Credentials credentials, List<String> topicFilters)
            throws ConnectionException, InterruptedException {
        RetryState state = new RetryState(policy);
        while (true) {
            try {
                BrokerSession session = connector.connect(address, credentials, topicFilters);
                state.onSuccess();
                return session;
            } catch (ConnectionException e) {
                long delay = state.onFailure(e);
                if (delay < 0) {
                    log.error("Giving up connecting to {} after {} attempts", address, state.failures());
                    throw e;
                }
                log.warn("Connecting to {} failed (attempt {}): {}; retrying in {} ms",
                        address, state.failures(), e.getMessage(), delay);
                Thread.sleep(delay);
                state.onAttempt();
            }
        }
    }
}
