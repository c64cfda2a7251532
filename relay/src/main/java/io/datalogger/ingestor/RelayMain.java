package io.datalogger.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.datalogger.config.RelayConfig;
import io.datalogger.decode.RejectLog;
import io.datalogger.forward.Forwarder;
import io.datalogger.grpc.RelayAdminServer;
import io.datalogger.queue.DurableQueue;
import io.datalogger.runtime.RelayPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

public class RelayMain {
    private static final Logger log = LoggerFactory.getLogger(RelayMain.class);

    public static void main(String[] args) throws Exception {
        RelayConfig cfg = RelayConfig.fromEnv();
        log.info("Starting datalogger relay with {}", cfg);
        // blocks until the broker accepts the first connection
        Injector injector = Guice.createInjector(new RelayModule(cfg));
        RelayPipeline pipeline = injector.getInstance(RelayPipeline.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        DurableQueue queue = injector.getInstance(DurableQueue.class);
        Forwarder forwarder = injector.getInstance(Forwarder.class);
        RejectLog rejectLog = injector.getInstance(RejectLog.class);

        CountDownLatch done = new CountDownLatch(1);
        RelayAdminServer admin = new RelayAdminServer(cfg.adminPort(), pipeline, registry);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            pipeline.close();
            pipeline.session().close();
            admin.close();
            try {
                forwarder.close();
                rejectLog.close();
            } catch (Exception e) {
                log.warn("Error while closing resources", e);
            }
            queue.close();
            done.countDown();
        }, "relay-shutdown"));

        pipeline.start();
        admin.start();
        done.await();
    }
}
