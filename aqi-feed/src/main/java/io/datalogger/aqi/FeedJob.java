package io.datalogger.aqi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the jobs file: {@code {"job_name": "...", "api": {"email": "...", "password": "..."}}}.
 */
public record FeedJob(String name, String email, String password) {

    public boolean hasCredentials() {
        return email != null && !email.isEmpty() && password != null && !password.isEmpty();
    }

    public static List<FeedJob> load(Path file, ObjectMapper mapper) throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        if (root == null || !root.isArray()) throw new IOException(file + " must contain a JSON array of jobs");
        List<FeedJob> jobs = new ArrayList<>();
        for (JsonNode job : root) {
            JsonNode api = job.path("api");
            jobs.add(new FeedJob(
                    job.path("job_name").asText("Unnamed Job"),
                    api.path("email").isTextual() ? api.path("email").asText() : null,
                    api.path("password").isTextual() ? api.path("password").asText() : null));
        }
        return jobs;
    }
}
