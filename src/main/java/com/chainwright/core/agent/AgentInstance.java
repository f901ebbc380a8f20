package com.chainwright.core.agent;

import com.chainwright.core.model.ContextView;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A running agent bound to exactly one chain run.
 * <p>
 * State moves forward only: SPAWNED, RUNNING, then one terminal state. The outcome future is the
 * instance's completion channel; it is completed exactly once, by the worker, the timeout
 * watchdog or a forced cancellation, whichever comes first.
 */
public final class AgentInstance {

    private final String id;
    private final String runId;
    private final AgentDescriptor descriptor;
    private final AgentTask task;
    private final ContextView context;
    private final AtomicReference<InstanceState> state = new AtomicReference<>(InstanceState.SPAWNED);
    private final AtomicInteger attempts = new AtomicInteger();
    private final CompletableFuture<AgentOutcome> outcome = new CompletableFuture<>();
    private volatile boolean cancelRequested;
    private volatile Thread runner;

    AgentInstance(String runId, AgentDescriptor descriptor, AgentTask task, ContextView context) {
        this.id = descriptor.kind().name().toLowerCase() + "-" + UUID.randomUUID().toString().substring(0, 8);
        this.runId = runId;
        this.descriptor = descriptor;
        this.task = task;
        this.context = context;
    }

    public String id() { return id; }
    public String runId() { return runId; }
    public AgentDescriptor descriptor() { return descriptor; }
    public AgentKind kind() { return descriptor.kind(); }
    public AgentTask task() { return task; }
    public ContextView context() { return context; }
    public InstanceState state() { return state.get(); }
    public int attempts() { return attempts.get(); }
    public boolean isCancelRequested() { return cancelRequested; }

    CompletableFuture<AgentOutcome> outcome() {
        return outcome;
    }

    int nextAttempt() {
        return attempts.incrementAndGet();
    }

    /**
     * Moves to RUNNING unless the instance already reached a terminal state.
     */
    boolean markRunning(Thread thread) {
        runner = thread;
        return state.compareAndSet(InstanceState.SPAWNED, InstanceState.RUNNING)
                || state.get() == InstanceState.RUNNING;
    }

    /**
     * Completes the instance with a terminal outcome. Only the first completion counts.
     *
     * @return {@code true} if this call completed the instance
     */
    boolean finish(AgentOutcome result) {
        if (!result.state().isTerminal()) {
            throw new IllegalArgumentException("Outcome state must be terminal: " + result.state());
        }
        InstanceState current;
        do {
            current = state.get();
            if (current.isTerminal()) return false;
        } while (!state.compareAndSet(current, result.state()));
        outcome.complete(result);
        return true;
    }

    void clearRunner() {
        runner = null;
    }

    /**
     * Signals cancellation and interrupts the worker if it is running.
     */
    void requestCancel() {
        cancelRequested = true;
        Thread t = runner;
        if (t != null) {
            t.interrupt();
        }
    }

    @Override
    public String toString() {
        return "AgentInstance[" + id + ", run " + runId + ", " + state.get() + "]";
    }
}
