package com.chainwright.core.engine;

import com.chainwright.core.model.ChainRun;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of the runs of this process: the latest snapshot, the graph state to
 * resume from, and the abort and execution flags the graph routing consults.
 */
@Component
public class RunRegistry {

    private static final class Entry {
        volatile ChainRun snapshot;
        volatile Map<String, Object> state = Map.of();
        volatile boolean abortRequested;
        volatile boolean executing;

        Entry(ChainRun snapshot) {
            this.snapshot = snapshot;
        }
    }

    private final Map<String, Entry> runs = new ConcurrentHashMap<>();

    public void register(ChainRun run) {
        if (runs.putIfAbsent(run.runId(), new Entry(run)) != null) {
            throw new IllegalStateException("Run " + run.runId() + " is already registered");
        }
    }

    public Optional<ChainRun> find(String runId) {
        var entry = runs.get(runId);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot);
    }

    public List<ChainRun> all() {
        return runs.values().stream().map(e -> e.snapshot).toList();
    }

    public void update(ChainRun run, Map<String, Object> state) {
        var entry = require(run.runId());
        entry.snapshot = run;
        if (state != null) {
            entry.state = Map.copyOf(state);
        }
    }

    public Map<String, Object> state(String runId) {
        return require(runId).state;
    }

    /**
     * Marks the run as executing a stage.
     *
     * @return false if another thread already drives it
     */
    public synchronized boolean beginExecution(String runId) {
        var entry = require(runId);
        if (entry.executing) return false;
        entry.executing = true;
        return true;
    }

    public void endExecution(String runId) {
        require(runId).executing = false;
    }

    public boolean isExecuting(String runId) {
        var entry = runs.get(runId);
        return entry != null && entry.executing;
    }

    public void requestAbort(String runId) {
        require(runId).abortRequested = true;
    }

    public boolean isAbortRequested(String runId) {
        var entry = runs.get(runId);
        return entry != null && entry.abortRequested;
    }

    private Entry require(String runId) {
        var entry = runs.get(runId);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown run " + runId);
        }
        return entry;
    }
}
