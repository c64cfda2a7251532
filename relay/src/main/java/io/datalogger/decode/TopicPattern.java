package io.datalogger.decode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MQTT topic filter with an optional named {@code {device}} level that captures the device id.
 * {@code +} matches one level, {@code #} (last level only) matches the parent and any number of
 * levels below it. Example: {@code sensors/{device}/#}.
 */
public final class TopicPattern {
    public static final String DEVICE = "{device}";

    private final String pattern;
    private final String[] levels;
    private final int deviceLevel;

    private TopicPattern(String pattern, String[] levels, int deviceLevel) {
        this.pattern = pattern;
        this.levels = levels;
        this.deviceLevel = deviceLevel;
    }

    public static TopicPattern compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.isEmpty()) throw new IllegalArgumentException("empty topic pattern");
        String[] levels = pattern.split("/", -1);
        int device = -1;
        for (int i = 0; i < levels.length; i++) {
            String l = levels[i];
            if (l.equals("#") && i != levels.length - 1) {
                throw new IllegalArgumentException("'#' must be the last level: " + pattern);
            }
            if (l.equals(DEVICE)) {
                if (device >= 0) throw new IllegalArgumentException("more than one {device} level: " + pattern);
                device = i;
            } else if (!l.equals("+") && !l.equals("#") && (l.contains("+") || l.contains("#"))) {
                throw new IllegalArgumentException("wildcards must occupy a whole level: " + pattern);
            }
        }
        return new TopicPattern(pattern, levels, device);
    }

    public static List<TopicPattern> compileAll(List<String> patterns) {
        List<TopicPattern> out = new ArrayList<>(patterns.size());
        for (String p : patterns) out.add(compile(p.trim()));
        return out;
    }

    /** Pattern with {@code {device}} replaced by {@code +}, suitable for a broker subscription. */
    public String subscriptionFilter() {
        return pattern.replace(DEVICE, "+");
    }

    public Optional<Match> match(String topic) {
        if (topic == null || topic.isEmpty()) return Optional.empty();
        String[] parts = topic.split("/", -1);
        String device = null;
        for (int i = 0; i < levels.length; i++) {
            String l = levels[i];
            if (l.equals("#")) {
                return Optional.of(new Match(this, device));
            }
            if (i >= parts.length) return Optional.empty();
            if (i == deviceLevel) {
                if (parts[i].isEmpty()) return Optional.empty();
                device = parts[i];
            } else if (!l.equals("+") && !l.equals(parts[i])) {
                return Optional.empty();
            }
        }
        return parts.length == levels.length ? Optional.of(new Match(this, device)) : Optional.empty();
    }

    public String pattern() { return pattern; }

    @Override
    public String toString() { return pattern; }

    /** Successful match; {@code deviceId} is empty when the pattern has no device level. */
    public record Match(TopicPattern pattern, String device) {
        public Optional<String> deviceId() { return Optional.ofNullable(device); }
    }
}
