package com.example.scheduler;

import com.cronutils.model.CronType;
import lombok.Builder;
import lombok.Getter;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;

/**
 * Service settings, read from environment variables.
 */
@Getter
@Builder
public class SchedulerConfig {
    public enum StoreType {
        MEMORY, CASSANDRA
    }

    private final int httpPort;
    private final StoreType storeType;
    private final String cassandraContactPoint;
    private final int cassandraPort;
    private final String cassandraKeyspace;
    private final String cassandraLocalDc;
    private final int cassandraReplicationFactor;
    private final CronType cronType;
    private final ZoneId timezone;
    private final Duration requestTimeout;

    public static SchedulerConfig fromEnv(Map<String, String> env) {
        return SchedulerConfig.builder()
                .httpPort(intValue(env, "SCHEDULER_HTTP_PORT", "8082"))
                .storeType(enumValue(StoreType.class, env, "SCHEDULER_STORE", "memory"))
                .cassandraContactPoint(value(env, "CASSANDRA_CONTACT_POINT", "127.0.0.1"))
                .cassandraPort(intValue(env, "CASSANDRA_PORT", "9042"))
                .cassandraKeyspace(value(env, "CASSANDRA_KEYSPACE", "scheduler"))
                .cassandraLocalDc(value(env, "CASS_LOCAL_DC", "DC1"))
                .cassandraReplicationFactor(intValue(env, "CASSANDRA_REPLICATION_FACTOR", "3"))
                .cronType(enumValue(CronType.class, env, "SCHEDULER_CRON_TYPE", "spring"))
                .timezone(zone(value(env, "SCHEDULER_TIMEZONE", "UTC")))
                .requestTimeout(Duration.ofMillis(positiveIntValue(env, "WEBHOOK_REQUEST_TIMEOUT_MS", "10000")))
                .build();
    }

    private static String value(Map<String, String> env, String key, String def) {
        String v = env.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static int intValue(Map<String, String> env, String key, String def) {
        String v = value(env, key, def);
        try {
            int n = Integer.parseInt(v);
            if (n < 0) {
                throw new IllegalArgumentException(key + " must be >= 0, got: " + v);
            }
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got: " + v);
        }
    }

    private static int positiveIntValue(Map<String, String> env, String key, String def) {
        int n = intValue(env, key, def);
        if (n == 0) {
            throw new IllegalArgumentException(key + " must be > 0, got: " + n);
        }
        return n;
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, Map<String, String> env, String key, String def) {
        String v = value(env, key, def);
        try {
            return Enum.valueOf(type, v.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(key + " has unsupported value: " + v);
        }
    }

    private static ZoneId zone(String v) {
        try {
            return ZoneId.of(v);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("SCHEDULER_TIMEZONE is not a valid zone: " + v);
        }
    }
}
