package com.chainwright.mcp;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fixed-size window of recent capability-call outcomes for one server.
 * Not thread-safe; guarded by {@link ServerRegistry}.
 */
final class RollingMetrics {

    private record Sample(long latencyMs, boolean success) {}

    private final int window;
    private final Deque<Sample> samples = new ArrayDeque<>();

    RollingMetrics(int window) {
        this.window = Math.max(1, window);
    }

    void record(long latencyMs, boolean success) {
        samples.addLast(new Sample(latencyMs, success));
        while (samples.size() > window) {
            samples.removeFirst();
        }
    }

    void clear() {
        samples.clear();
    }

    boolean hasFailures() {
        return samples.stream().anyMatch(s -> !s.success());
    }

    int size() {
        return samples.size();
    }

    /** Success rate in [0,1]; 1.0 with no samples. */
    double successRate() {
        if (samples.isEmpty()) return 1.0;
        long ok = samples.stream().filter(Sample::success).count();
        return (double) ok / samples.size();
    }

    /** Mean latency in ms; 0 with no samples. */
    double averageLatencyMs() {
        if (samples.isEmpty()) return 0.0;
        return samples.stream().mapToLong(Sample::latencyMs).average().orElse(0.0);
    }
}
