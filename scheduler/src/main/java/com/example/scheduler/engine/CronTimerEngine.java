package com.example.scheduler.engine;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.example.scheduler.exception.InvalidScheduleException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TimerEngine backed by cron-utils.
 *
 * Each entry keeps exactly one pending tick on the ticker pool. When a tick fires the
 * callback is handed to the dispatch pool and the next tick is computed from the
 * fired instant, so a slow callback never delays later ticks and runs of the same
 * entry may overlap.
 */
@Slf4j
public class CronTimerEngine implements TimerEngine {
    private final CronParser parser;
    private final ZoneId zone;
    private final ScheduledExecutorService ticker;
    private final ExecutorService dispatchPool;
    private final Set<Entry> entries = ConcurrentHashMap.newKeySet();
    private volatile boolean started = false;
    private volatile boolean shutdown = false;

    public CronTimerEngine(CronType cronType, ZoneId zone) {
        this.parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(cronType));
        this.zone = zone;
        this.ticker = Executors.newSingleThreadScheduledExecutor(namedThreads("cron-ticker"));
        this.dispatchPool = Executors.newCachedThreadPool(namedThreads("cron-dispatch"));
    }

    @Override
    public void start() {
        if (shutdown) {
            throw new IllegalStateException("engine already stopped");
        }
        started = true;
        for (Entry e : entries) {
            e.scheduleNext();
        }
        log.info("Cron engine started with {} entries", entries.size());
    }

    @Override
    public CronEntry schedule(String expression, Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback is required");
        }
        if (shutdown) {
            throw new IllegalStateException("engine already stopped");
        }
        ExecutionTime executionTime = parse(expression);
        Entry entry = new Entry(expression.trim(), executionTime, callback);
        entries.add(entry);
        if (started) {
            entry.scheduleNext();
        }
        return entry;
    }

    @Override
    public void validate(String expression) {
        parse(expression);
    }

    @Override
    public void stop() {
        shutdown = true;
        for (Entry e : entries) {
            e.stop();
        }
        List<Runnable> notRun = ticker.shutdownNow();
        dispatchPool.shutdownNow();
        log.info("Cron engine stopped. Ticks not run {}", notRun.size());
    }

    public boolean isStarted() {
        return started && !shutdown;
    }

    /** Number of live registrations. */
    public int size() {
        return entries.size();
    }

    private ExecutionTime parse(String expression) {
        String expr = (expression == null ? "" : expression.trim());
        if (expr.isEmpty()) {
            throw new InvalidScheduleException(String.valueOf(expression), "cron expression is required");
        }
        Cron cron;
        try {
            cron = parser.parse(expr);
            cron.validate();
        } catch (RuntimeException e) {
            throw new InvalidScheduleException(expr, e);
        }
        ExecutionTime et = ExecutionTime.forCron(cron);
        if (et.nextExecution(ZonedDateTime.now(zone)).isEmpty()) {
            throw new InvalidScheduleException(expr, "cron has no next execution time");
        }
        return et;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private final class Entry implements CronEntry {
        private final String expression;
        private final ExecutionTime executionTime;
        private final Runnable callback;
        private ScheduledFuture<?> pending;
        private ZonedDateTime nextAt;
        private volatile boolean stopped = false;

        Entry(String expression, ExecutionTime executionTime, Runnable callback) {
            this.expression = expression;
            this.executionTime = executionTime;
            this.callback = callback;
        }

        synchronized void scheduleNext() {
            if (stopped || pending != null && !pending.isDone()) {
                return;
            }
            ZonedDateTime now = ZonedDateTime.now(zone);
            // never compute from before the last tick, the ticker may wake a little early
            ZonedDateTime base = (nextAt != null && nextAt.isAfter(now)) ? nextAt : now;
            Optional<ZonedDateTime> next = executionTime.nextExecution(base);
            if (next.isEmpty()) {
                log.info("Cron '{}' has no further executions", expression);
                nextAt = null;
                return;
            }
            nextAt = next.get();
            long delayMs = Math.max(0, Duration.between(now, nextAt).toMillis());
            try {
                pending = ticker.schedule(this::tick, delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Ticker shut down, cron '{}' not rescheduled", expression);
            }
        }

        private void tick() {
            synchronized (this) {
                if (stopped) {
                    return;
                }
                pending = null;
            }
            try {
                dispatchPool.execute(this::runCallback);
            } catch (RejectedExecutionException e) {
                log.debug("Dispatch pool shut down, skipping tick for '{}'", expression);
                return;
            }
            scheduleNext();
        }

        private void runCallback() {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Cron callback for '{}' failed", expression, e);
            }
        }

        @Override
        public String expression() {
            return expression;
        }

        @Override
        public synchronized Optional<Instant> nextExecution() {
            if (stopped || nextAt == null) {
                return Optional.empty();
            }
            return Optional.of(nextAt.toInstant());
        }

        @Override
        public void stop() {
            synchronized (this) {
                if (stopped) {
                    return;
                }
                stopped = true;
                if (pending != null) {
                    pending.cancel(false);
                    pending = null;
                }
            }
            entries.remove(this);
        }

        @Override
        public boolean isStopped() {
            return stopped;
        }
    }
}
