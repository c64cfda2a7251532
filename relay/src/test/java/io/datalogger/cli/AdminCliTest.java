package io.datalogger.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datalogger.testing.AdminFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AdminCliTest {
    @TempDir
    Path dir;

    AdminFixture fixture;
    final ObjectMapper mapper = new ObjectMapper();
    StringWriter out;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new AdminFixture(dir);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private int run(String... args) {
        out = new StringWriter();
        CommandLine cmd = new CommandLine(new AdminCli().withChannel(fixture.channel));
        cmd.setOut(new PrintWriter(out, true));
        return cmd.execute(args);
    }

    private JsonNode json() throws Exception {
        return mapper.readTree(out.toString());
    }

    @Test
    void status_prints_json() throws Exception {
        assertEquals(0, run("status"));
        JsonNode s = json();
        assertFalse(s.get("running").asBoolean());
        assertTrue(s.get("brokerConnected").asBoolean());
        assertEquals(0, s.get("queuePending").asInt());
        assertEquals("IDLE", s.get("workers").get("intake").asText());
    }

    @Test
    void control_exit_code_follows_acceptance() throws Exception {
        assertEquals(0, run("control", "pause"));
        assertTrue(json().get("accepted").asBoolean());
        assertTrue(fixture.pipeline.isPaused());

        assertEquals(2, run("control", "explode"));
        assertFalse(json().get("accepted").asBoolean());
    }

    @Test
    void dead_letters_and_replay() throws Exception {
        fixture.deadLetter("boiler", "chiller");

        assertEquals(0, run("dead-letters", "-n", "5"));
        JsonNode listed = json();
        assertEquals(2, listed.get("total").asInt());
        assertEquals("boiler", listed.get("entries").get(0).get("device").asText());
        assertEquals("sensors/chiller", listed.get("entries").get(1).get("topic").asText());

        assertEquals(0, run("replay", "--limit", "1"));
        assertEquals(1, json().get("replayed").asInt());
        assertEquals(1, fixture.queue.deadLetterCount());
    }

    @Test
    void metrics_and_health_print_json() throws Exception {
        assertEquals(0, run("metrics"));
        assertEquals(0, json().get("acks").asLong());
        assertEquals(0, run("health"));
        assertTrue(json().get("ready").asBoolean());
    }

    @Test
    void no_subcommand_prints_usage() {
        assertEquals(2, run());
        assertTrue(out.toString().contains("relay-admin"));
    }
}
