package com.example.scheduler.store;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.example.scheduler.exception.StoreUnavailableException;
import com.example.scheduler.model.Event;
import com.example.scheduler.model.EventQuery;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * EventStore on Cassandra.
 *
 * Ids come from the event_seq table through LWT compare-and-set, so every instance
 * sharing the keyspace hands out distinct ids. Query filtering is done client-side to
 * avoid ALLOW FILTERING.
 */
@Slf4j
public class CassandraEventStore implements EventStore, AutoCloseable {
    private static final String SEQ_NAME = "events";
    private static final int MAX_SEQ_ATTEMPTS = 10;

    private final CqlSession session;
    private final PreparedStatement insertEventStmt;
    private final PreparedStatement selectEventStmt;
    private final PreparedStatement selectAllEventsStmt;
    private final PreparedStatement deleteEventStmt;
    private final PreparedStatement selectSeqStmt;
    private final PreparedStatement insertSeqIfNotExistsStmt;
    private final PreparedStatement updateSeqIfStmt;

    public CassandraEventStore(CqlSession session) {
        this.session = session;
        createSchema(session);
        this.insertEventStmt = session.prepare(
                "INSERT INTO events (id, expression, url, max_retries, retry_timeout_seconds, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?)");
        this.selectEventStmt = session.prepare(
                "SELECT id, expression, url, max_retries, retry_timeout_seconds, created_at, updated_at FROM events WHERE id = ?");
        this.selectAllEventsStmt = session.prepare(
                "SELECT id, expression, url, max_retries, retry_timeout_seconds, created_at, updated_at FROM events");
        this.deleteEventStmt = session.prepare(
                "DELETE FROM events WHERE id = ? IF EXISTS");
        this.selectSeqStmt = session.prepare(
                "SELECT last_id FROM event_seq WHERE name = ?");
        this.insertSeqIfNotExistsStmt = session.prepare(
                "INSERT INTO event_seq (name, last_id) VALUES (?, ?) IF NOT EXISTS");
        this.updateSeqIfStmt = session.prepare(
                "UPDATE event_seq SET last_id = ? WHERE name = ? IF last_id = ?");
    }

    /**
     * Opens a session, creating the keyspace first when it is missing.
     */
    public static CassandraEventStore connect(String contactPoint, int port, String keyspace, String localDc,
            int replicationFactor) {
        try {
            try (CqlSession bootstrap = CqlSession.builder()
                    .addContactPoint(new InetSocketAddress(contactPoint, port))
                    .withLocalDatacenter(localDc)
                    .build()) {
                ensureKeyspace(bootstrap, keyspace, replicationFactor);
            }
            CqlSession session = CqlSession.builder()
                    .addContactPoint(new InetSocketAddress(contactPoint, port))
                    .withLocalDatacenter(localDc)
                    .withKeyspace(keyspace)
                    .build();
            return new CassandraEventStore(session);
        } catch (DriverException e) {
            throw new StoreUnavailableException("cannot connect to cassandra at " + contactPoint + ":" + port, e);
        }
    }

    static void ensureKeyspace(CqlSession session, String keyspace, int replicationFactor) {
        ResultSet rs = session.execute(
                "SELECT keyspace_name FROM system_schema.keyspaces WHERE keyspace_name='" + keyspace + "'");
        if (rs.one() == null) {
            log.info("Keyspace '{}' not found. Creating...", keyspace);
            session.execute("CREATE KEYSPACE IF NOT EXISTS " + keyspace
                    + " WITH replication = {'class':'SimpleStrategy','replication_factor':" + replicationFactor + "}");
            log.info("Keyspace '{}' created", keyspace);
        }
    }

    private static void createSchema(CqlSession session) {
        session.execute("CREATE TABLE IF NOT EXISTS events (id bigint PRIMARY KEY, expression text, url text, "
                + "max_retries int, retry_timeout_seconds bigint, created_at timestamp, updated_at timestamp)");
        session.execute("CREATE TABLE IF NOT EXISTS event_seq (name text PRIMARY KEY, last_id bigint)");
    }

    @Override
    public List<Event> findEvents(EventQuery query) {
        EventQuery q = (query == null ? new EventQuery() : query);
        return call("find events", () -> {
            List<Event> out = new ArrayList<>();
            for (Row row : session.execute(selectAllEventsStmt.bind())) {
                Event e = toEvent(row);
                if (q.matches(e)) {
                    out.add(e);
                }
            }
            out.sort(Comparator.comparingLong(Event::getId));
            return out;
        });
    }

    @Override
    public Optional<Event> findById(long id) {
        return call("find event " + id, () -> {
            Row r = session.execute(selectEventStmt.bind(id)).one();
            return r == null ? Optional.<Event>empty() : Optional.of(toEvent(r));
        });
    }

    @Override
    public Event save(Event event) {
        return call("save event", () -> {
            Event toSave = event.copy();
            Instant now = Instant.now();
            if (toSave.getId() == 0) {
                toSave.setId(nextId());
                toSave.setCreatedAt(now);
            } else if (toSave.getCreatedAt() == null) {
                Row existing = session.execute(selectEventStmt.bind(toSave.getId())).one();
                toSave.setCreatedAt(existing == null ? now : existing.getInstant("created_at"));
            }
            toSave.setUpdatedAt(now);
            session.execute(insertEventStmt.bind(toSave.getId(), toSave.getExpression(), toSave.getUrl(),
                    toSave.getMaxRetries(), toSave.getRetryTimeoutSeconds(), toSave.getCreatedAt(),
                    toSave.getUpdatedAt()));
            return toSave;
        });
    }

    @Override
    public boolean delete(long id) {
        return call("delete event " + id, () -> {
            Row r = session.execute(deleteEventStmt.bind(id)).one();
            return r != null && r.getBoolean("[applied]");
        });
    }

    /**
     * Next id from event_seq, compare-and-set on last_id.
     */
    long nextId() {
        Row ins = session.execute(insertSeqIfNotExistsStmt.bind(SEQ_NAME, 1L)).one();
        if (ins != null && ins.getBoolean("[applied]")) {
            return 1L;
        }
        for (int attempt = 0; attempt < MAX_SEQ_ATTEMPTS; attempt++) {
            Row current = session.execute(selectSeqStmt.bind(SEQ_NAME)).one();
            long old = (current == null || current.isNull("last_id")) ? 0L : current.getLong("last_id");
            long next = old + 1;
            Row upd = session.execute(updateSeqIfStmt.bind(next, SEQ_NAME, old)).one();
            if (upd != null && upd.getBoolean("[applied]")) {
                return next;
            }
            // contention -> retry with a fresh read
        }
        throw new IllegalStateException("could not allocate event id after " + MAX_SEQ_ATTEMPTS + " attempts");
    }

    private static Event toEvent(Row r) {
        return Event.builder()
                .id(r.getLong("id"))
                .expression(r.getString("expression"))
                .url(r.getString("url"))
                .maxRetries(r.isNull("max_retries") ? 0 : r.getInt("max_retries"))
                .retryTimeoutSeconds(r.isNull("retry_timeout_seconds") ? 0L : r.getLong("retry_timeout_seconds"))
                .createdAt(r.getInstant("created_at"))
                .updatedAt(r.getInstant("updated_at"))
                .build();
    }

    private static <T> T call(String what, Supplier<T> op) {
        try {
            return op.get();
        } catch (DriverException e) {
            log.error("Cassandra failed to {}: {}", what, e.getMessage());
            throw new StoreUnavailableException("event store unavailable: " + what, e);
        }
    }

    @Override
    public void close() {
        session.close();
    }
}
