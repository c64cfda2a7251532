package io.datalogger.grpc;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Snapshot;
import com.codahale.metrics.Timer;
import io.datalogger.core.DeadLetter;
import io.datalogger.metrics.Metrics;
import io.datalogger.queue.DurableQueue;
import io.datalogger.runtime.CycleState;
import io.datalogger.runtime.RelayPipeline;
import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.protobuf.services.ProtoReflectionService;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

public class RelayAdminServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelayAdminServer.class);
    private static final int DEFAULT_LIMIT = 10;

    private final Server server;

    public RelayAdminServer(int port, RelayPipeline pipeline, MetricRegistry registry) {
        this.server = ServerBuilder.forPort(port)
                .addService(service(pipeline, registry))
                .addService(ProtoReflectionService.newInstance())
                .build();
    }

    /** The service on its own, for hosting in another server (in-process tests). */
    public static BindableService service(RelayPipeline pipeline, MetricRegistry registry) {
        return new ServiceImpl(pipeline, registry);
    }

    public void start() throws IOException {
        server.start();
        log.info("Admin gRPC listening on port {}", server.getPort());
    }

    public int port() { return server.getPort(); }

    @Override
    public void close() { server.shutdownNow(); }

    private static class ServiceImpl extends RelayAdminGrpc.RelayAdminImplBase {
        private final RelayPipeline pipeline;
        private final DurableQueue queue;
        private final MetricRegistry registry;

        ServiceImpl(RelayPipeline pipeline, MetricRegistry registry) {
            this.pipeline = pipeline;
            this.queue = pipeline.queue();
            this.registry = registry;
        }

        @Override
        public void getStatus(Empty request, StreamObserver<Status> responseObserver) {
            Status.Builder b = Status.newBuilder()
                    .setRunning(pipeline.isRunning())
                    .setPaused(pipeline.isPaused())
                    .setBrokerConnected(pipeline.session().isConnected())
                    .setQueuePending(queue.pendingCount())
                    .setQueueSize(queue.size())
                    .setDeadLetters(queue.deadLetterCount())
                    .setPendingAcks(pipeline.pendingAckCount());
            for (Map.Entry<String, CycleState> e : pipeline.states().entrySet()) {
                b.addWorkers(WorkerState.newBuilder().setWorker(e.getKey()).setState(e.getValue().name()));
            }
            responseObserver.onNext(b.build());
            responseObserver.onCompleted();
        }

        @Override
        public void getMetrics(Empty request, StreamObserver<MetricsSummary> responseObserver) {
            Timer decode = registry.timer(Metrics.DECODE_TIME);
            Timer forward = registry.timer(Metrics.FORWARD_TIME);
            Snapshot fs = forward.getSnapshot();
            Histogram sizes = registry.histogram(Metrics.FORWARD_BATCH_SIZE);
            Snapshot ss = sizes.getSnapshot();
            MetricsSummary resp = MetricsSummary.newBuilder()
                    .setInboundCount(registry.meter(Metrics.INBOUND_RATE).getCount())
                    .setInboundRate1M(registry.meter(Metrics.INBOUND_RATE).getOneMinuteRate())
                    .setDecodeRejected(registry.meter(Metrics.DECODE_REJECTED).getCount())
                    .setEnqueueFailed(registry.meter(Metrics.ENQUEUE_FAILED).getCount())
                    .setForwardDelivered(registry.meter(Metrics.FORWARD_DELIVERED).getCount())
                    .setForwardFailed(registry.meter(Metrics.FORWARD_FAILED).getCount())
                    .setAcks(registry.counter(Metrics.ACK_COUNT).getCount())
                    .setDeadLettered(registry.counter(Metrics.DEAD_LETTER_COUNT).getCount())
                    .setDecodeP50Ms(nsToMs(decode.getSnapshot().getMedian()))
                    .setForwardP50Ms(nsToMs(fs.getMedian()))
                    .setForwardP95Ms(nsToMs(fs.get95thPercentile()))
                    .setForwardP99Ms(nsToMs(fs.get99thPercentile()))
                    .setBatchSizeP50(ss.getMedian())
                    .setBatchSizeMean(ss.getMean())
                    .build();
            responseObserver.onNext(resp);
            responseObserver.onCompleted();
        }

        @Override
        public void control(ControlRequest request, StreamObserver<ControlResponse> responseObserver) {
            String action = request.getAction().toLowerCase(Locale.ROOT);
            ControlResponse.Builder b = ControlResponse.newBuilder().setAccepted(true);
            switch (action) {
                case "pause" -> pipeline.pause();
                case "resume" -> pipeline.resume();
                case "stop" -> pipeline.stop();
                default -> b.setAccepted(false).setMessage("unknown action '" + request.getAction() + "', expected pause|resume|stop");
            }
            log.info("Admin control '{}' accepted={}", request.getAction(), b.getAccepted());
            responseObserver.onNext(b.build());
            responseObserver.onCompleted();
        }

        @Override
        public void listDeadLetters(DeadLettersRequest request, StreamObserver<DeadLetters> responseObserver) {
            int limit = request.getLimit() <= 0 ? DEFAULT_LIMIT : request.getLimit();
            DeadLetters.Builder b = DeadLetters.newBuilder().setTotal(queue.deadLetterCount());
            for (DeadLetter d : queue.deadLetters(limit)) {
                b.addEntries(DeadLetterEntry.newBuilder()
                        .setSequence(d.sequence())
                        .setTopic(d.reading().topic())
                        .setDeviceId(d.reading().deviceId())
                        .setTimestamp(d.reading().timestamp().toString())
                        .setAttempts(d.attempts())
                        .setReason(d.reason() == null ? "" : d.reason())
                        .setFailedAt(d.failedAt().toString()));
            }
            responseObserver.onNext(b.build());
            responseObserver.onCompleted();
        }

        @Override
        public void replayDeadLetters(ReplayRequest request, StreamObserver<ReplayResponse> responseObserver) {
            int limit = request.getLimit() <= 0 ? DEFAULT_LIMIT : request.getLimit();
            int replayed = queue.replayDeadLetters(limit);
            log.info("Replayed {} dead letter(s) through admin", replayed);
            responseObserver.onNext(ReplayResponse.newBuilder().setReplayed(replayed).build());
            responseObserver.onCompleted();
        }

        @Override
        public void health(Empty request, StreamObserver<HealthStatus> responseObserver) {
            HealthStatus hs = HealthStatus.newBuilder()
                    .setReady(true)
                    .setRunning(pipeline.isRunning())
                    .setBrokerConnected(pipeline.session().isConnected())
                    .build();
            responseObserver.onNext(hs);
            responseObserver.onCompleted();
        }

        private static double nsToMs(double ns) { return ns / 1_000_000.0; }
    }
}
