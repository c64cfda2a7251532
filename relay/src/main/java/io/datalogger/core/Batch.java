package io.datalogger.core;

import java.util.List;

/**
 * Records selected together for one forwarding attempt, in ascending sequence order.
 */
public record Batch(List<QueuedRecord> records) {
    private static final Batch EMPTY = new Batch(List.of());

    public Batch {
        records = List.copyOf(records);
        for (int i = 1; i < records.size(); i++) {
            if (records.get(i - 1).sequence() >= records.get(i).sequence()) {
                throw new IllegalArgumentException("batch records must be in ascending sequence order");
            }
        }
    }

    public static Batch empty() { return EMPTY; }

    public boolean isEmpty() { return records.isEmpty(); }
    public int size() { return records.size(); }

    public List<Long> sequences() {
        return records.stream().map(QueuedRecord::sequence).toList();
    }

    public long firstSequence() {
        if (records.isEmpty()) throw new IllegalStateException("empty batch");
        return records.get(0).sequence();
    }

    public long lastSequence() {
        if (records.isEmpty()) throw new IllegalStateException("empty batch");
        return records.get(records.size() - 1).sequence();
    }
}
