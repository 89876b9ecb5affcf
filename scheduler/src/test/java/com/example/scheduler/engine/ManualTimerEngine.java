package com.example.scheduler.engine;

import com.example.scheduler.exception.InvalidScheduleException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * TimerEngine that only fires when a test says so. Callbacks run on the calling thread.
 */
public class ManualTimerEngine implements TimerEngine {
    public static final String INVALID = "not a cron";

    private final List<ManualEntry> entries = new CopyOnWriteArrayList<>();
    private volatile boolean started = false;
    private volatile boolean stopped = false;

    @Override
    public void start() {
        started = true;
    }

    @Override
    public CronEntry schedule(String expression, Runnable callback) {
        validate(expression);
        ManualEntry e = new ManualEntry(expression, callback);
        entries.add(e);
        return e;
    }

    @Override
    public void validate(String expression) {
        if (expression == null || expression.isBlank() || INVALID.equals(expression)) {
            throw new InvalidScheduleException(String.valueOf(expression), "rejected by manual engine");
        }
    }

    @Override
    public void stop() {
        stopped = true;
        entries.forEach(ManualEntry::stop);
    }

    /** Fire every live entry once; returns how many fired. */
    public int fireAll() {
        int fired = 0;
        for (ManualEntry e : new ArrayList<>(entries)) {
            if (e.fire()) {
                fired++;
            }
        }
        return fired;
    }

    public List<ManualEntry> liveEntries() {
        return entries.stream().filter(e -> !e.isStopped()).collect(Collectors.toList());
    }

    public List<ManualEntry> allEntries() {
        return new ArrayList<>(entries);
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isStopped() {
        return stopped;
    }

    public static class ManualEntry implements CronEntry {
        private final String expression;
        private final Runnable callback;
        private volatile boolean stopped = false;

        ManualEntry(String expression, Runnable callback) {
            this.expression = expression;
            this.callback = callback;
        }

        public boolean fire() {
            if (stopped) {
                return false;
            }
            callback.run();
            return true;
        }

        @Override
        public String expression() {
            return expression;
        }

        @Override
        public Optional<Instant> nextExecution() {
            return stopped ? Optional.empty() : Optional.of(Instant.now().plusSeconds(60));
        }

        @Override
        public void stop() {
            stopped = true;
        }

        @Override
        public boolean isStopped() {
            return stopped;
        }
    }
}
