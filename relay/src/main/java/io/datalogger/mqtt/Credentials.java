package io.datalogger.mqtt;

import java.util.Optional;

public record Credentials(String username, String password) {
    public static Credentials anonymous() { return new Credentials(null, null); }

    public Optional<String> user() {
        return username == null || username.isEmpty() ? Optional.empty() : Optional.of(username);
    }

    @Override
    public String toString() {
        return "Credentials{" + user().orElse("<anonymous>") + '}';
    }
}
