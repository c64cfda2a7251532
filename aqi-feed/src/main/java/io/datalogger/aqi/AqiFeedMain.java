package io.datalogger.aqi;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datalogger.mqtt.BrokerAddress;
import io.datalogger.mqtt.Credentials;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the AQI.in API and publishes the first device's readings to the broker as a datalogger
 * text line.
 */
@Command(name = "aqi-feed", mixinStandardHelpOptions = true, description = "Publish AQI.in readings to an MQTT broker",
        subcommands = DiscoverCommand.class)
public final class AqiFeedMain implements Callable<Integer> {
    @Option(names = "--email", description = "AQI account email", defaultValue = "${AQI_EMAIL}")
    String email;

    @Option(names = "--password", description = "AQI account password", defaultValue = "${AQI_PASSWORD}")
    String password;

    @Option(names = "--login-url", defaultValue = "https://airquality.aqi.in/api/v1/login")
    URI loginUrl;

    @Option(names = "--devices-url", defaultValue = "https://airquality.aqi.in/api/v1/GetAllUserDevices")
    URI devicesUrl;

    @Option(names = {"-H", "--broker-host"}, defaultValue = "${MQTT_HOST:-localhost}")
    String brokerHost;

    @Option(names = {"-P", "--broker-port"}, defaultValue = "${MQTT_PORT:-1883}")
    int brokerPort;

    @Option(names = "--broker-user", defaultValue = "${MQTT_USER}")
    String brokerUser;

    @Option(names = "--broker-password", defaultValue = "${MQTT_PASS}")
    String brokerPassword;

    @Option(names = "--client-id", defaultValue = "datalogger-aqi-feed")
    String clientId;

    @Option(names = {"-t", "--topic"}, description = "Topic to publish to", defaultValue = "test/display_1")
    String topic;

    @Option(names = {"-i", "--interval"}, description = "Seconds between cycles", defaultValue = "10")
    long intervalSeconds;

    @Option(names = "--csv", description = "Audit CSV file", defaultValue = "api_mqtt_log.csv")
    Path csv;

    @Option(names = "--zone", description = "Zone for the DATE field and audit timestamps; default system zone")
    ZoneId zone;

    @Option(names = "--once", description = "Run a single cycle and exit")
    boolean once;

    public static void main(String[] args) {
        System.exit(new CommandLine(new AqiFeedMain()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        if (email == null || password == null) {
            System.err.println("AQI credentials are required (--email/--password or AQI_EMAIL/AQI_PASSWORD)");
            return 2;
        }
        if (intervalSeconds <= 0) {
            System.err.println("Interval must be positive");
            return 2;
        }
        Clock clock = zone == null ? Clock.systemDefaultZone() : Clock.system(zone);
        ObjectMapper mapper = new ObjectMapper();
        MetricRegistry registry = new MetricRegistry();
        AqiClient client = new AqiClient(HttpClient.newHttpClient(), loginUrl, devicesUrl, email, password,
                Duration.ofSeconds(15), mapper);
        FeedPublisher publisher = new MqttFeedPublisher(new BrokerAddress(brokerHost, brokerPort, clientId),
                new Credentials(brokerUser, brokerPassword), topic);
        FeedCycle cycle = new FeedCycle(client, new AqiPayloadFormatter(clock), publisher, new CsvAuditLog(csv, clock),
                mapper, registry);

        if (once) {
            FeedCycle.Outcome outcome = cycle.runOnce();
            System.out.println(outcome);
            return outcome == FeedCycle.Outcome.PUBLISHED ? 0 : 1;
        }

        Slf4jReporter reporter = Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger("io.datalogger.aqi.metrics"))
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();
        reporter.start(5, TimeUnit.MINUTES);

        AtomicBoolean running = new AtomicBoolean(true);
        Thread main = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            running.set(false);
            main.interrupt();
        }, "aqi-feed-shutdown"));
        try {
            cycle.run(Duration.ofSeconds(intervalSeconds), running::get);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            reporter.report();
            reporter.stop();
        }
        return 0;
    }
}
