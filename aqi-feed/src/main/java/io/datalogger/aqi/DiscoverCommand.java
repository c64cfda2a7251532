package io.datalogger.aqi;

import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Lists the devices behind every account in a jobs file, to find the serial numbers to feed.
 */
@Command(name = "discover", mixinStandardHelpOptions = true, description = "List AQI.in devices for each job in a jobs file")
public final class DiscoverCommand implements Callable<Integer> {
    private static final String RULE = "    " + "-".repeat(40);

    @Option(names = {"-c", "--config"}, description = "Jobs JSON file", defaultValue = "config.json")
    Path config;

    @Option(names = "--login-url", description = "AQI login endpoint", defaultValue = "https://airquality.aqi.in/api/v1/login")
    URI loginUrl;

    @Option(names = "--devices-url", description = "AQI device list endpoint", defaultValue = "https://airquality.aqi.in/api/v1/GetAllUserDevices")
    URI devicesUrl;

    @Option(names = "--timeout", description = "Request timeout in seconds", defaultValue = "15")
    long timeoutSeconds;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    public DiscoverCommand() {
        this(HttpClient.newHttpClient());
    }

    DiscoverCommand(HttpClient http) {
        this.http = http;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new DiscoverCommand()).execute(args));
    }

    @Override
    public Integer call() throws InterruptedException {
        PrintWriter out = spec.commandLine().getOut();
        out.println("=== AQI.IN DEVICE DISCOVERY ===");
        if (!Files.exists(config)) {
            spec.commandLine().getErr().println("ERROR: " + config + " not found.");
            return 1;
        }
        List<FeedJob> jobs;
        try {
            jobs = FeedJob.load(config, mapper);
        } catch (IOException e) {
            spec.commandLine().getErr().println("ERROR: Could not parse " + config + ". " + e.getMessage());
            return 1;
        }
        if (jobs.isEmpty()) {
            out.println("No jobs found in config.");
            return 0;
        }
        for (FeedJob job : jobs) {
            if (!job.hasCredentials()) {
                out.println();
                out.println(">>> Skipping Job: " + job.name() + " (Missing credentials)");
                continue;
            }
            discover(job, out);
        }
        out.flush();
        return 0;
    }

    private void discover(FeedJob job, PrintWriter out) throws InterruptedException {
        out.println();
        out.println(">>> Checking Job: " + job.name() + " (" + job.email() + ")");
        AqiClient client = new AqiClient(http, loginUrl, devicesUrl, job.email(), job.password(),
                Duration.ofSeconds(timeoutSeconds), mapper);
        try {
            client.login();
            AqiClient.ApiResponse resp = client.fetchDevices();
            if (!resp.ok()) {
                out.println("    [!] Device Fetch Failed. Status: " + resp.statusCode());
                return;
            }
            List<AqiDevice> devices = AqiClient.devices(mapper.readTree(resp.body()));
            if (devices.isEmpty()) {
                out.println("    (No devices found in this account)");
                return;
            }
            out.println("    Found " + devices.size() + " device(s):");
            out.println(RULE);
            for (AqiDevice d : devices) {
                out.println("    - Device Name : " + d.name());
                out.println("      Serial No   : " + d.serialNo());
                out.println(RULE);
            }
        } catch (AqiApiException e) {
            out.println(e.statusCode() > 0
                    ? "    [!] Login Failed. Status: " + e.statusCode()
                    : "    [!] Auth Failed: " + e.getMessage());
        } catch (IOException e) {
            out.println("    [!] Error: " + e.getMessage());
        }
    }
}
