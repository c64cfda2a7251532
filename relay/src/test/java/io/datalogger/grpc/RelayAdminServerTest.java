package io.datalogger.grpc;

import io.datalogger.metrics.Metrics;
import io.datalogger.testing.AdminFixture;
import io.datalogger.testing.Readings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelayAdminServerTest {
    @TempDir
    Path dir;

    AdminFixture fixture;
    RelayAdminGrpc.RelayAdminBlockingStub stub;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new AdminFixture(dir);
        stub = RelayAdminGrpc.newBlockingStub(fixture.channel);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void status_reports_pipeline_and_queue() {
        fixture.queue.enqueue(Readings.temp("a", 1));
        Status s = stub.getStatus(Empty.getDefaultInstance());
        assertFalse(s.getRunning());
        assertFalse(s.getPaused());
        assertTrue(s.getBrokerConnected());
        assertEquals(1, s.getQueuePending());
        assertEquals(1, s.getQueueSize());
        assertEquals(0, s.getDeadLetters());
        assertEquals(List.of("intake", "forward-0", "forward-1"),
                s.getWorkersList().stream().map(WorkerState::getWorker).toList());
        assertEquals("IDLE", s.getWorkers(0).getState());
    }

    @Test
    void control_pauses_and_resumes() {
        assertTrue(stub.control(ControlRequest.newBuilder().setAction("pause").build()).getAccepted());
        assertTrue(fixture.pipeline.isPaused());
        assertTrue(stub.getStatus(Empty.getDefaultInstance()).getPaused());
        assertTrue(stub.control(ControlRequest.newBuilder().setAction("RESUME").build()).getAccepted());
        assertFalse(fixture.pipeline.isPaused());
    }

    @Test
    void unknown_control_action_is_refused() {
        ControlResponse r = stub.control(ControlRequest.newBuilder().setAction("reboot").build());
        assertFalse(r.getAccepted());
        assertTrue(r.getMessage().contains("reboot"));
    }

    @Test
    void dead_letters_can_be_listed_and_replayed() {
        fixture.deadLetter("a", "b", "c");

        DeadLetters listed = stub.listDeadLetters(DeadLettersRequest.newBuilder().setLimit(2).build());
        assertEquals(3, listed.getTotal());
        assertEquals(2, listed.getEntriesCount());
        DeadLetterEntry first = listed.getEntries(0);
        assertEquals("sensors/a", first.getTopic());
        assertEquals("a", first.getDeviceId());
        assertEquals(1, first.getAttempts());
        assertTrue(first.getReason().contains("400"));

        assertEquals(3, stub.listDeadLetters(DeadLettersRequest.getDefaultInstance()).getEntriesCount());

        ReplayResponse replayed = stub.replayDeadLetters(ReplayRequest.newBuilder().setLimit(2).build());
        assertEquals(2, replayed.getReplayed());
        assertEquals(1, fixture.queue.deadLetterCount());
        assertEquals(2, fixture.queue.pendingCount());
    }

    @Test
    void metrics_summary_reads_the_registry() {
        fixture.registry.counter(Metrics.ACK_COUNT).inc(5);
        fixture.registry.histogram(Metrics.FORWARD_BATCH_SIZE).update(8);
        MetricsSummary m = stub.getMetrics(Empty.getDefaultInstance());
        assertEquals(5, m.getAcks());
        assertEquals(8.0, m.getBatchSizeP50());
        assertEquals(0, m.getDecodeRejected());
    }

    @Test
    void health_reports_readiness() {
        HealthStatus h = stub.health(Empty.getDefaultInstance());
        assertTrue(h.getReady());
        assertFalse(h.getRunning());
        assertTrue(h.getBrokerConnected());
    }
}
