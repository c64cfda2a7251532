package io.datalogger.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datalogger.core.Batch;
import io.datalogger.core.DeadLetter;
import io.datalogger.core.DeliveryState;
import io.datalogger.core.QueuedRecord;
import io.datalogger.core.Reading;
import io.datalogger.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JDBC-backed durable queue, intended for an embedded H2 file database
 * (e.g. {@code jdbc:h2:file:./data/queue}). Every mutation is its own committed transaction and
 * runs under a single lock, so enqueue and batch selection never interleave.
 *
 * <p>Schema: {@code relay_queue} holds pending and in-flight records, {@code relay_dead_letter}
 * holds records that will not be retried, {@code relay_sequence} keeps the last issued sequence
 * number so numbering stays increasing across restarts even after the queue drains.
 */
public class JdbcDurableQueue implements DurableQueue {
    private static final Logger log = LoggerFactory.getLogger(JdbcDurableQueue.class);
    private static final TypeReference<LinkedHashMap<String, Object>> VALUES_TYPE = new TypeReference<>() {};
    private static final int MAX_ERROR_LENGTH = 2048;

    private static final String RECORD_COLUMNS =
            "seq, topic, device_id, reading_ts, reading_values, payload, state, attempts, last_error, enqueued_at, next_attempt_at";
    private static final String DEAD_LETTER_COLUMNS =
            "seq, topic, device_id, reading_ts, reading_values, payload, attempts, reason, failed_at";

    private final Connection connection;
    private final int maxRecords;
    private final int maxAttempts;
    private final RetryPolicy backoff;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private long lastSequence;

    public JdbcDurableQueue(String jdbcUrl, String user, String password,
                            int maxRecords, int maxAttempts, RetryPolicy backoff,
                            ObjectMapper mapper, Clock clock) {
        this.maxRecords = Math.max(1, maxRecords);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        try {
            this.connection = (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
            this.connection.setAutoCommit(false);
            createSchema();
            this.lastSequence = loadLastSequence();
        } catch (SQLException e) {
            throw new QueueStorageException("cannot open queue at " + jdbcUrl, e);
        }
        int recovered = recover();
        if (recovered > 0) log.info("Returned {} in-flight records to pending after restart", recovered);
        log.info("Opened durable queue {} (records={}, deadLetters={}, lastSequence={})",
                jdbcUrl, size(), deadLetterCount(), lastSequence);
    }

    private void createSchema() throws SQLException {
        try (Statement s = connection.createStatement()) {
            s.execute("SET WRITE_DELAY 0");
            s.execute("CREATE TABLE IF NOT EXISTS relay_queue (" +
                    "seq BIGINT PRIMARY KEY, " +
                    "topic VARCHAR(1024) NOT NULL, " +
                    "device_id VARCHAR(255) NOT NULL, " +
                    "reading_ts VARCHAR(64) NOT NULL, " +
                    "reading_values CLOB NOT NULL, " +
                    "payload BLOB, " +
                    "state VARCHAR(16) NOT NULL, " +
                    "attempts INT NOT NULL, " +
                    "last_error VARCHAR(" + MAX_ERROR_LENGTH + "), " +
                    "enqueued_at BIGINT NOT NULL, " +
                    "next_attempt_at BIGINT NOT NULL)");
            s.execute("CREATE INDEX IF NOT EXISTS relay_queue_state_seq ON relay_queue(state, seq)");
            s.execute("CREATE TABLE IF NOT EXISTS relay_dead_letter (" +
                    "seq BIGINT PRIMARY KEY, " +
                    "topic VARCHAR(1024) NOT NULL, " +
                    "device_id VARCHAR(255) NOT NULL, " +
                    "reading_ts VARCHAR(64) NOT NULL, " +
                    "reading_values CLOB NOT NULL, " +
                    "payload BLOB, " +
                    "attempts INT NOT NULL, " +
                    "reason VARCHAR(" + MAX_ERROR_LENGTH + "), " +
                    "failed_at BIGINT NOT NULL)");
            s.execute("CREATE TABLE IF NOT EXISTS relay_sequence (id INT PRIMARY KEY, last_seq BIGINT NOT NULL)");
        }
        connection.commit();
    }

    private long loadLastSequence() throws SQLException {
        try (Statement s = connection.createStatement();
             ResultSet rs = s.executeQuery("SELECT last_seq FROM relay_sequence WHERE id = 1")) {
            if (rs.next()) return rs.getLong(1);
        }
        // first open: seed from whatever rows exist
        long max = 0;
        try (Statement s = connection.createStatement();
             ResultSet rs = s.executeQuery("SELECT GREATEST(COALESCE((SELECT MAX(seq) FROM relay_queue), 0), " +
                     "COALESCE((SELECT MAX(seq) FROM relay_dead_letter), 0))")) {
            if (rs.next()) max = rs.getLong(1);
        }
        try (PreparedStatement ps = connection.prepareStatement("INSERT INTO relay_sequence (id, last_seq) VALUES (1, ?)")) {
            ps.setLong(1, max);
            ps.executeUpdate();
        }
        connection.commit();
        return max;
    }

    @Override
    public long enqueue(Reading reading) {
        Objects.requireNonNull(reading, "reading");
        lock.lock();
        try {
            if (countAll() >= maxRecords) {
                throw new QueueStorageException("queue is full (" + maxRecords + " records)", null);
            }
            long seq = lastSequence + 1;
            long now = clock.millis();
            try (PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO relay_queue (" + RECORD_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setLong(1, seq);
                bindReading(ps, 2, reading);
                ps.setString(7, DeliveryState.PENDING.name());
                ps.setInt(8, 0);
                ps.setString(9, null);
                ps.setLong(10, now);
                ps.setLong(11, now);
                ps.executeUpdate();
            }
            storeLastSequence(seq);
            connection.commit();
            lastSequence = seq;
            changed.signalAll();
            return seq;
        } catch (SQLException e) {
            rollback();
            throw new QueueStorageException("enqueue failed for topic " + reading.topic(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Batch peekBatch(int maxSize) {
        if (maxSize <= 0) return Batch.empty();
        lock.lock();
        try {
            long now = clock.millis();
            List<QueuedRecord> selected = new ArrayList<>();
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT " + RECORD_COLUMNS + " FROM relay_queue WHERE state = ? ORDER BY seq LIMIT ?")) {
                ps.setString(1, DeliveryState.PENDING.name());
                ps.setInt(2, maxSize);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        QueuedRecord r = readRecord(rs);
                        if (r.nextAttemptAt().toEpochMilli() > now) break;
                        selected.add(r.withState(DeliveryState.IN_FLIGHT));
                    }
                }
            }
            if (selected.isEmpty()) return Batch.empty();
            try (PreparedStatement ps = connection.prepareStatement("UPDATE relay_queue SET state = ? WHERE seq = ?")) {
                for (QueuedRecord r : selected) {
                    ps.setString(1, DeliveryState.IN_FLIGHT.name());
                    ps.setLong(2, r.sequence());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            connection.commit();
            return new Batch(selected);
        } catch (SQLException e) {
            rollback();
            throw new QueueStorageException("batch selection failed", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void markDelivered(Collection<Long> sequences) {
        if (sequences == null || sequences.isEmpty()) return;
        lock.lock();
        try {
            try (PreparedStatement ps = connection.prepareStatement("DELETE FROM relay_queue WHERE seq = ?")) {
                for (Long seq : sequences) {
                    ps.setLong(1, seq);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            connection.commit();
            changed.signalAll();
        } catch (SQLException e) {
            rollback();
            throw new QueueStorageException("markDelivered failed for " + sequences.size() + " records", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean markFailed(long sequence, FailureReason reason) {
        Objects.requireNonNull(reason, "reason");
        lock.lock();
        try {
            QueuedRecord current = find(sequence);
            if (current == null) return false;
            int attempts = current.attempts() + 1;
            String error = truncate(reason.message());
            boolean dead = reason.permanent() || attempts >= maxAttempts;
            if (dead) {
                insertDeadLetter(sequence, current.reading(), attempts, error, clock.millis());
                try (PreparedStatement ps = connection.prepareStatement("DELETE FROM relay_queue WHERE seq = ?")) {
                    ps.setLong(1, sequence);
                    ps.executeUpdate();
                }
            } else {
                try (PreparedStatement ps = connection.prepareStatement(
                        "UPDATE relay_queue SET state = ?, attempts = ?, last_error = ?, next_attempt_at = ? WHERE seq = ?")) {
                    ps.setString(1, DeliveryState.PENDING.name());
                    ps.setInt(2, attempts);
                    ps.setString(3, error);
                    ps.setLong(4, clock.millis() + backoff.backoffMillis(attempts));
                    ps.setLong(5, sequence);
                    ps.executeUpdate();
                }
            }
            connection.commit();
            changed.signalAll();
            if (dead) {
                log.warn("Record {} moved to dead-letter after {} attempt(s): {}", sequence, attempts, error);
            }
            return dead;
        } catch (SQLException e) {
            rollback();
            throw new QueueStorageException("markFailed failed for record " + sequence, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int recover() {
        lock.lock();
        try {
            int n;
            try (PreparedStatement ps = connection.prepareStatement("UPDATE relay_queue SET state = ? WHERE state = ?")) {
                ps.setString(1, DeliveryState.PENDING.name());
                ps.setString(2, DeliveryState.IN_FLIGHT.name());
                n = ps.executeUpdate();
            }
            connection.commit();
            if (n > 0) changed.signalAll();
            return n;
        } catch (SQLException e) {
            rollback();
            throw new QueueStorageException("recover failed", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int pendingCount() {
        lock.lock();
        try (PreparedStatement ps = connection.prepareStatement("SELECT COUNT(*) FROM relay_queue WHERE state = ?")) {
            ps.setString(1, DeliveryState.PENDING.name());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new QueueStorageException("count failed", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return countAll();
        } catch (SQLException e) {
            throw new QueueStorageException("count failed", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int remainingCapacity() {
        return Math.max(0, maxRecords - size());
    }

    @Override
    public Optional<Instant> oldestPendingAt() {
        lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT enqueued_at FROM relay_queue WHERE state = ? ORDER BY seq LIMIT 1")) {
            ps.setString(1, DeliveryState.PENDING.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(Instant.ofEpochMilli(rs.getLong(1))) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new QueueStorageException("oldest pending lookup failed", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean awaitCapacity(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (countAll() >= maxRecords) {
                if (nanos <= 0) return false;
                nanos = changed.awaitNanos(nanos);
            }
            return true;
        } catch (SQLException e) {
            throw new QueueStorageException("count failed", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void awaitRecords(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            changed.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<DeadLetter> deadLetters(int limit) {
        lock.lock();
        try {
            return selectDeadLetters(Math.max(0, limit));
        } catch (SQLException e) {
            throw new QueueStorageException("dead-letter listing failed", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int deadLetterCount() {
        lock.lock();
        try (Statement s = connection.createStatement();
             ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM relay_dead_letter")) {
            rs.next();
            return rs.getInt(1);
        } catch (SQLException e) {
            throw new QueueStorageException("count failed", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int replayDeadLetters(int limit) {
        lock.lock();
        try {
            int room = maxRecords - countAll();
            List<DeadLetter> letters = selectDeadLetters(Math.min(Math.max(0, limit), Math.max(0, room)));
            if (letters.isEmpty()) return 0;
            long seq = lastSequence;
            long now = clock.millis();
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO relay_queue (" + RECORD_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)");
                 PreparedStatement delete = connection.prepareStatement("DELETE FROM relay_dead_letter WHERE seq = ?")) {
                for (DeadLetter letter : letters) {
                    seq++;
                    insert.setLong(1, seq);
                    bindReading(insert, 2, letter.reading());
                    insert.setString(7, DeliveryState.PENDING.name());
                    insert.setInt(8, 0);
                    insert.setString(9, null);
                    insert.setLong(10, now);
                    insert.setLong(11, now);
                    insert.addBatch();
                    delete.setLong(1, letter.sequence());
                    delete.addBatch();
                }
                insert.executeBatch();
                delete.executeBatch();
            }
            storeLastSequence(seq);
            connection.commit();
            lastSequence = seq;
            changed.signalAll();
            log.info("Replayed {} dead letter(s) into the queue", letters.size());
            return letters.size();
        } catch (SQLException e) {
            rollback();
            throw new QueueStorageException("dead-letter replay failed", e);
        } finally {
            lock.unlock();
        }
    }

    /** Last sequence number issued by this store. */
    public long lastSequence() {
        lock.lock();
        try {
            return lastSequence;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing durable queue", e);
        } finally {
            lock.unlock();
        }
    }

    private int countAll() throws SQLException {
        try (Statement s = connection.createStatement();
             ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM relay_queue")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private QueuedRecord find(long sequence) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT " + RECORD_COLUMNS + " FROM relay_queue WHERE seq = ?")) {
            ps.setLong(1, sequence);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? readRecord(rs) : null;
            }
        }
    }

    private List<DeadLetter> selectDeadLetters(int limit) throws SQLException {
        List<DeadLetter> out = new ArrayList<>();
        if (limit == 0) return out;
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + DEAD_LETTER_COLUMNS + " FROM relay_dead_letter ORDER BY seq LIMIT ?")) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new DeadLetter(rs.getLong("seq"), readReading(rs), rs.getInt("attempts"),
                            rs.getString("reason"), Instant.ofEpochMilli(rs.getLong("failed_at"))));
                }
            }
        }
        return out;
    }

    private void insertDeadLetter(long seq, Reading reading, int attempts, String reason, long failedAt) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO relay_dead_letter (" + DEAD_LETTER_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ps.setLong(1, seq);
            bindReading(ps, 2, reading);
            ps.setInt(7, attempts);
            ps.setString(8, reason);
            ps.setLong(9, failedAt);
            ps.executeUpdate();
        }
    }

    private void storeLastSequence(long seq) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("UPDATE relay_sequence SET last_seq = ? WHERE id = 1")) {
            ps.setLong(1, seq);
            ps.executeUpdate();
        }
    }

    /** Binds topic, device id, timestamp, values and payload starting at {@code index}. */
    private void bindReading(PreparedStatement ps, int index, Reading reading) throws SQLException {
        ps.setString(index, reading.topic());
        ps.setString(index + 1, reading.deviceId());
        ps.setString(index + 2, reading.timestamp().toString());
        try {
            ps.setString(index + 3, mapper.writeValueAsString(reading.values()));
        } catch (JsonProcessingException e) {
            throw new SQLException("cannot serialize reading values", e);
        }
        ps.setBytes(index + 4, reading.payload());
    }

    private QueuedRecord readRecord(ResultSet rs) throws SQLException {
        return new QueuedRecord(
                rs.getLong("seq"),
                readReading(rs),
                DeliveryState.valueOf(rs.getString("state")),
                rs.getInt("attempts"),
                rs.getString("last_error"),
                Instant.ofEpochMilli(rs.getLong("enqueued_at")),
                Instant.ofEpochMilli(rs.getLong("next_attempt_at")));
    }

    private Reading readReading(ResultSet rs) throws SQLException {
        Map<String, Object> values;
        try {
            values = mapper.readValue(rs.getString("reading_values"), VALUES_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("corrupt reading values for record " + rs.getLong("seq"), e);
        }
        Instant ts;
        try {
            ts = Instant.parse(rs.getString("reading_ts"));
        } catch (DateTimeParseException e) {
            throw new SQLException("corrupt timestamp for record " + rs.getLong("seq"), e);
        }
        return new Reading(rs.getString("topic"), rs.getString("device_id"), ts, values, rs.getBytes("payload"));
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() <= MAX_ERROR_LENGTH ? s : s.substring(0, MAX_ERROR_LENGTH);
    }

    private void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed", e);
        }
    }
}
