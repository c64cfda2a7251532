package io.datalogger.cli;

import io.datalogger.grpc.ControlRequest;
import io.datalogger.grpc.ControlResponse;
import io.datalogger.grpc.DeadLetterEntry;
import io.datalogger.grpc.DeadLetters;
import io.datalogger.grpc.DeadLettersRequest;
import io.datalogger.grpc.Empty;
import io.datalogger.grpc.HealthStatus;
import io.datalogger.grpc.MetricsSummary;
import io.datalogger.grpc.RelayAdminGrpc;
import io.datalogger.grpc.ReplayRequest;
import io.datalogger.grpc.ReplayResponse;
import io.datalogger.grpc.Status;
import io.datalogger.grpc.WorkerState;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command line client for the relay's admin gRPC service. Prints one JSON object per call.
 */
@Command(name = "relay-admin", mixinStandardHelpOptions = true, description = "Inspect and control a running relay",
        subcommands = {
                AdminCli.StatusCommand.class,
                AdminCli.MetricsCommand.class,
                AdminCli.ControlCommand.class,
                AdminCli.DeadLettersCommand.class,
                AdminCli.ReplayCommand.class,
                AdminCli.HealthCommand.class
        })
public final class AdminCli implements Callable<Integer> {
    @Option(names = "--host", description = "Admin host", defaultValue = "${DATALOGGER_ADMIN_HOST:-127.0.0.1}")
    String host;

    @Option(names = "--port", description = "Admin gRPC port", defaultValue = "${DATALOGGER_ADMIN_PORT:-9090}")
    int port;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private ManagedChannel channel;

    public static void main(String[] args) {
        System.exit(new CommandLine(new AdminCli()).execute(args));
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 2;
    }

    /** Tests can point the CLI at an in-process channel. */
    AdminCli withChannel(ManagedChannel channel) {
        this.channel = channel;
        return this;
    }

    <T> T call(Function<RelayAdminGrpc.RelayAdminBlockingStub, T> rpc) {
        ManagedChannel ch = channel != null ? channel : ManagedChannelBuilder.forAddress(host, port).usePlaintext().build();
        try {
            return rpc.apply(RelayAdminGrpc.newBlockingStub(ch));
        } finally {
            if (channel == null) ch.shutdownNow();
        }
    }

    PrintWriter out() { return spec.commandLine().getOut(); }

    @Command(name = "status", description = "Pipeline state and queue depth")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand AdminCli parent;

        @Override
        public Integer call() {
            Status s = parent.call(stub -> stub.getStatus(Empty.getDefaultInstance()));
            StringBuilder workers = new StringBuilder();
            for (WorkerState w : s.getWorkersList()) {
                if (workers.length() > 0) workers.append(',');
                workers.append('"').append(w.getWorker()).append("\":\"").append(w.getState()).append('"');
            }
            parent.out().printf("{\"running\":%s,\"paused\":%s,\"brokerConnected\":%s,\"queuePending\":%d,\"queueSize\":%d,"
                            + "\"deadLetters\":%d,\"pendingAcks\":%d,\"workers\":{%s}}%n",
                    s.getRunning(), s.getPaused(), s.getBrokerConnected(), s.getQueuePending(), s.getQueueSize(),
                    s.getDeadLetters(), s.getPendingAcks(), workers);
            return 0;
        }
    }

    @Command(name = "metrics", description = "Throughput and latency summary")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand AdminCli parent;

        @Override
        public Integer call() {
            MetricsSummary m = parent.call(stub -> stub.getMetrics(Empty.getDefaultInstance()));
            parent.out().printf(Locale.ROOT, "{\"inbound\":%d,\"inboundRate1m\":%.2f,\"decodeRejected\":%d,\"enqueueFailed\":%d,"
                            + "\"delivered\":%d,\"failed\":%d,\"acks\":%d,\"deadLettered\":%d,\"decodeP50Ms\":%.2f,"
                            + "\"forwardP50Ms\":%.2f,\"forwardP95Ms\":%.2f,\"forwardP99Ms\":%.2f,\"batchSizeP50\":%.1f,\"batchSizeMean\":%.1f}%n",
                    m.getInboundCount(), m.getInboundRate1M(), m.getDecodeRejected(), m.getEnqueueFailed(),
                    m.getForwardDelivered(), m.getForwardFailed(), m.getAcks(), m.getDeadLettered(), m.getDecodeP50Ms(),
                    m.getForwardP50Ms(), m.getForwardP95Ms(), m.getForwardP99Ms(), m.getBatchSizeP50(), m.getBatchSizeMean());
            return 0;
        }
    }

    @Command(name = "control", description = "pause | resume | stop")
    static final class ControlCommand implements Callable<Integer> {
        @ParentCommand AdminCli parent;

        @Parameters(index = "0", description = "Action: pause, resume or stop")
        String action;

        @Override
        public Integer call() {
            ControlResponse r = parent.call(stub -> stub.control(ControlRequest.newBuilder().setAction(action).build()));
            parent.out().printf("{\"accepted\":%s,\"message\":\"%s\"}%n", r.getAccepted(), escape(r.getMessage()));
            return r.getAccepted() ? 0 : 2;
        }
    }

    @Command(name = "dead-letters", description = "List dead-lettered records, oldest first")
    static final class DeadLettersCommand implements Callable<Integer> {
        @ParentCommand AdminCli parent;

        @Option(names = {"-n", "--limit"}, defaultValue = "10")
        int limit;

        @Override
        public Integer call() {
            DeadLetters d = parent.call(stub -> stub.listDeadLetters(DeadLettersRequest.newBuilder().setLimit(limit).build()));
            StringBuilder sb = new StringBuilder("{\"total\":").append(d.getTotal()).append(",\"entries\":[");
            for (int i = 0; i < d.getEntriesCount(); i++) {
                DeadLetterEntry e = d.getEntries(i);
                if (i > 0) sb.append(',');
                sb.append("{\"seq\":").append(e.getSequence())
                        .append(",\"topic\":\"").append(escape(e.getTopic()))
                        .append("\",\"device\":\"").append(escape(e.getDeviceId()))
                        .append("\",\"attempts\":").append(e.getAttempts())
                        .append(",\"reason\":\"").append(escape(e.getReason()))
                        .append("\",\"failedAt\":\"").append(e.getFailedAt()).append("\"}");
            }
            parent.out().println(sb.append("]}"));
            return 0;
        }
    }

    @Command(name = "replay", description = "Move dead letters back into the queue")
    static final class ReplayCommand implements Callable<Integer> {
        @ParentCommand AdminCli parent;

        @Option(names = {"-n", "--limit"}, defaultValue = "10")
        int limit;

        @Override
        public Integer call() {
            ReplayResponse r = parent.call(stub -> stub.replayDeadLetters(ReplayRequest.newBuilder().setLimit(limit).build()));
            parent.out().printf("{\"replayed\":%d}%n", r.getReplayed());
            return 0;
        }
    }

    @Command(name = "health", description = "Readiness probe")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand AdminCli parent;

        @Override
        public Integer call() {
            HealthStatus h = parent.call(stub -> stub.health(Empty.getDefaultInstance()));
            parent.out().printf("{\"ready\":%s,\"running\":%s,\"brokerConnected\":%s}%n", h.getReady(), h.getRunning(), h.getBrokerConnected());
            return h.getReady() ? 0 : 1;
        }
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
