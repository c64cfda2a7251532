package io.datalogger.forward;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datalogger.core.Batch;
import io.datalogger.core.QueuedRecord;
import io.datalogger.core.Reading;

import java.time.Instant;
import java.util.Base64;
import java.util.Map;

/**
 * Encodes a batch as the collector's {@code datalogger.batch/v1} JSON document:
 * <pre>
 * {"schema":"datalogger.batch/v1","batch_id":"17-42","sent_at":"...",
 *  "readings":[{"seq":17,"topic":"..","device_id":"..","timestamp":"..","values":{..},"payload":"base64"}]}
 * </pre>
 * {@code batch_id} is stable across retries of the same records, so collectors can deduplicate.
 */
public class BatchCodec {
    public static final String SCHEMA = "datalogger.batch/v1";
    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper mapper;

    public BatchCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static String batchId(Batch batch) {
        return batch.firstSequence() + "-" + batch.lastSequence();
    }

    public byte[] encode(Batch batch, Instant sentAt) {
        ObjectNode root = mapper.createObjectNode();
        root.put("schema", SCHEMA);
        root.put("batch_id", batchId(batch));
        root.put("sent_at", sentAt.toString());
        ArrayNode readings = root.putArray("readings");
        for (QueuedRecord r : batch.records()) {
            Reading reading = r.reading();
            ObjectNode n = readings.addObject();
            n.put("seq", r.sequence());
            n.put("topic", reading.topic());
            n.put("device_id", reading.deviceId());
            n.put("timestamp", reading.timestamp().toString());
            ObjectNode values = n.putObject("values");
            for (Map.Entry<String, Object> e : reading.values().entrySet()) {
                values.set(e.getKey(), mapper.valueToTree(e.getValue()));
            }
            n.put("payload", Base64.getEncoder().encodeToString(reading.payload()));
        }
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("batch " + batchId(batch) + " could not be encoded", e);
        }
    }
}
