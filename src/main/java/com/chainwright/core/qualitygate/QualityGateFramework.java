package com.chainwright.core.qualitygate;

import com.chainwright.core.catalog.CatalogException;
import com.chainwright.core.catalog.ChainCatalog;
import com.chainwright.core.catalog.StageDefinition;
import com.chainwright.core.config.ChainwrightProperties;
import com.chainwright.core.metrics.ChainMetrics;
import com.chainwright.core.scoring.BoundaryPolicy;
import com.chainwright.mcp.CapabilityCall;
import com.chainwright.mcp.CapabilityInvoker;
import com.chainwright.mcp.CapabilityUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes quality gates against stage output.
 * <p>
 * Strategies:
 * <ul>
 *   <li>SEQUENTIAL: dependency order, stops at the first required gate that does not pass; the
 *       remaining gates are reported in {@link GateReport#notRun()}</li>
 *   <li>PARALLEL: dependency levels, each level run in batches of at most {@code parallelism} gates</li>
 *   <li>ADAPTIVE: the stage's gate subset from the catalog mapping, executed as PARALLEL</li>
 * </ul>
 * Dependencies of a selected gate are pulled in transitively. A gate whose dependency did not
 * pass is BLOCKED without running. A gate with capability tags averages each server's
 * {@code {"score","findings"}} response into its checker score. A timed-out gate scores 0.
 */
@Service
public class QualityGateFramework {

    private static final Logger log = LoggerFactory.getLogger(QualityGateFramework.class);

    private final ChainCatalog catalog;
    private final Map<String, GateChecker> checkers;
    private final CapabilityInvoker capabilityInvoker;
    private final ChainwrightProperties properties;
    private final ChainMetrics metrics;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExecutorService executor;

    public QualityGateFramework(ChainCatalog catalog, List<GateChecker> checkers,
                                CapabilityInvoker capabilityInvoker, ChainwrightProperties properties,
                                ChainMetrics metrics) {
        this.catalog = catalog;
        this.capabilityInvoker = capabilityInvoker;
        this.properties = properties;
        this.metrics = metrics;

        var byId = new HashMap<String, GateChecker>();
        for (var checker : checkers) {
            if (byId.put(checker.id(), checker) != null) {
                throw new IllegalStateException("Duplicate gate checker id: " + checker.id());
            }
        }
        this.checkers = Map.copyOf(byId);
        for (var gate : catalog.gates().values()) {
            if (!this.checkers.containsKey(gate.checker())) {
                throw new CatalogException("Gate '" + gate.id() + "' references unknown checker '" + gate.checker() + "'");
            }
        }

        var threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "gate-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Evaluates the requested gates.
     *
     * @throws CapabilityUnavailableException if a gate needs a non-degradable capability that is unavailable
     */
    public GateReport evaluate(GateRequest request) {
        var strategy = request.strategy() != null ? request.strategy() : properties.getGates().getStrategy();
        var stage = request.input().stage();
        List<String> selected = strategy == GateExecutionStrategy.ADAPTIVE
                ? catalog.adaptiveGatesFor(stage.id())
                : request.gateIds();

        List<QualityGate> ordered = withDependencies(selected);
        log.info("Evaluating {} gate(s) for {} with {} strategy: {}", ordered.size(), stage.id(), strategy,
                ordered.stream().map(QualityGate::id).toList());

        GateReport report = strategy == GateExecutionStrategy.SEQUENTIAL
                ? runSequential(request, ordered)
                : runParallel(request, ordered, strategy);

        for (var r : report.results()) {
            metrics.recordGateResult(r.gateId(), r.status().name());
        }
        log.info("Gate report for {}: {}", stage.id(), report.summary());
        return report;
    }

    private GateReport runSequential(GateRequest request, List<QualityGate> ordered) {
        var results = new LinkedHashMap<String, GateResult>();
        var notRun = new ArrayList<String>();
        boolean stopped = false;
        for (var gate : ordered) {
            if (stopped) {
                notRun.add(gate.id());
                continue;
            }
            var result = runGate(request, gate, results);
            results.put(gate.id(), result);
            if (result.blocking()) {
                log.info("Sequential gate run stopped at required gate {} ({})", gate.id(), result.status());
                stopped = true;
            }
        }
        return new GateReport(request.input().stage().id(), GateExecutionStrategy.SEQUENTIAL,
                new ArrayList<>(results.values()), notRun);
    }

    private GateReport runParallel(GateRequest request, List<QualityGate> ordered, GateExecutionStrategy strategy) {
        var results = new LinkedHashMap<String, GateResult>();
        int parallelism = Math.max(1, properties.getGates().getParallelism());

        for (List<QualityGate> level : levels(ordered)) {
            for (int from = 0; from < level.size(); from += parallelism) {
                var batch = level.subList(from, Math.min(level.size(), from + parallelism));
                var pending = new LinkedHashMap<QualityGate, Future<GateResult>>();
                var snapshot = Map.copyOf(results);
                for (var gate : batch) {
                    pending.put(gate, executor.submit(() -> runGate(request, gate, snapshot)));
                }
                for (var entry : pending.entrySet()) {
                    results.put(entry.getKey().id(), join(entry.getValue()));
                }
            }
        }
        // report in dependency order, independent of completion order
        var inOrder = new ArrayList<GateResult>();
        for (var gate : ordered) {
            inOrder.add(results.get(gate.id()));
        }
        return new GateReport(request.input().stage().id(), strategy, inOrder, List.of());
    }

    private GateResult join(Future<GateResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while evaluating gates", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Gate evaluation failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    /**
     * Runs one gate unless a dependency did not pass. Checker and capability work is bounded by the gate timeout.
     */
    GateResult runGate(GateRequest request, QualityGate gate, Map<String, GateResult> completed) {
        boolean required = requiredFor(gate, request.input().stage());
        var unmet = new ArrayList<String>();
        for (String dep : gate.dependsOn()) {
            var depResult = completed.get(dep);
            if (depResult == null || depResult.status() != GateStatus.PASSED) {
                unmet.add(dep);
            }
        }
        if (!unmet.isEmpty()) {
            log.info("Gate {} blocked by {}", gate.id(), unmet);
            return GateResult.blocked(gate, required, unmet);
        }

        long start = System.currentTimeMillis();
        Future<Scored> future = executor.submit(() -> score(request, gate));
        Scored scored;
        try {
            scored = future.get(gate.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Gate {} timed out after {}ms", gate.id(), gate.timeoutMs());
            scored = new Scored(0.0, Map.of("timeout", 0.0),
                    List.of("timed out after " + gate.timeoutMs() + "ms"));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running gate " + gate.id(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CapabilityUnavailableException cue) {
                throw cue;
            }
            log.warn("Gate {} checker error: {}", gate.id(), cause.getMessage(), cause);
            scored = new Scored(0.0, Map.of("error", 0.0), List.of("checker error: " + cause.getMessage()));
        }
        long duration = System.currentTimeMillis() - start;

        var policy = properties.getScoring().getBoundaryPolicy();
        GateStatus status;
        if (policy.meets(scored.score(), gate.threshold())) {
            status = GateStatus.PASSED;
        } else {
            status = required ? GateStatus.FAILED : GateStatus.WARNING;
        }
        if (BoundaryPolicy.onBoundary(scored.score(), gate.threshold())) {
            log.info("Gate {} score {} sits on its threshold, resolved {} as {}", gate.id(), scored.score(), policy, status);
        }
        if (status == GateStatus.WARNING) {
            log.warn("Optional gate {} below threshold: {} < {}", gate.id(), scored.score(), gate.threshold());
        } else {
            log.debug("Gate {} {} with {}", gate.id(), status, scored.score());
        }
        return new GateResult(gate.id(), status, scored.score(), gate.threshold(), required,
                scored.breakdown(), scored.findings(), duration);
    }

    /**
     * The stage's own gate lists decide whether a gate blocks; gates the stage does not list
     * (dependencies, adaptive additions) fall back to the catalog flag.
     */
    static boolean requiredFor(QualityGate gate, StageDefinition stage) {
        if (stage.requiredGates().contains(gate.id())) return true;
        if (stage.optionalGates().contains(gate.id())) return false;
        return gate.required();
    }

    private record Scored(double score, Map<String, Double> breakdown, List<String> findings) {}

    private Scored score(GateRequest request, QualityGate gate) {
        var input = request.input();
        GateCheck check = checkers.get(gate.checker()).check(input);
        var breakdown = new LinkedHashMap<String, Double>();
        var findings = new ArrayList<>(check.findings());
        breakdown.put("checker:" + gate.checker(), check.score());

        double sum = check.score();
        int parts = 1;
        for (String capability : gate.requiredCapabilityTags()) {
            var response = capabilityInvoker.invoke(new CapabilityCall(request.runId(),
                    request.runId() + ":gate:" + gate.id(), null, capability,
                    Map.of("gate", gate.id(), "stage", input.stage().id().name(), "content", input.content())));
            if (response.degraded()) {
                findings.add("capability '" + capability + "' unavailable; scored by checker only (confidence reduced)");
                continue;
            }
            var serverScore = parseServerScore(response.result(), findings, response.serverId());
            if (serverScore != null) {
                breakdown.put("mcp:" + response.serverId(), serverScore);
                sum += serverScore;
                parts++;
            }
            if (response.confidenceReduced()) {
                findings.add("capability '" + capability + "' served by fallback '" + response.servedCapability() + "'");
            }
        }
        return new Scored(sum / parts, breakdown, findings);
    }

    private Double parseServerScore(String json, List<String> findings, String serverId) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("score") || !node.get("score").isNumber()) {
                findings.add("server " + serverId + " returned no score");
                return null;
            }
            double score = Math.max(0.0, Math.min(1.0, node.get("score").asDouble()));
            var serverFindings = node.get("findings");
            if (serverFindings != null && serverFindings.isArray()) {
                serverFindings.forEach(f -> findings.add(serverId + ": " + f.asText()));
            }
            return score;
        } catch (Exception e) {
            log.warn("Unparseable gate response from {}: {}", serverId, e.getMessage());
            findings.add("server " + serverId + " returned an unparseable response");
            return null;
        }
    }

    /**
     * Returns the selected gates plus their transitive dependencies, dependencies first,
     * otherwise keeping the selection order.
     */
    List<QualityGate> withDependencies(List<String> selected) {
        var ordered = new LinkedHashSet<String>();
        for (String id : selected) {
            visit(id, ordered, new LinkedHashSet<>());
        }
        return ordered.stream().map(catalog::gate).toList();
    }

    private void visit(String id, Set<String> ordered, Set<String> path) {
        if (ordered.contains(id)) return;
        if (!path.add(id)) {
            throw new CatalogException("Quality gate dependency cycle through '" + id + "'");
        }
        for (String dep : catalog.gate(id).dependsOn()) {
            visit(dep, ordered, path);
        }
        ordered.add(id);
    }

    /**
     * Groups gates (already in dependency order) into levels: a gate's level is one more than its
     * deepest dependency.
     */
    static List<List<QualityGate>> levels(List<QualityGate> ordered) {
        var levelOf = new HashMap<String, Integer>();
        var levels = new ArrayList<List<QualityGate>>();
        for (var gate : ordered) {
            int level = 0;
            for (String dep : gate.dependsOn()) {
                level = Math.max(level, levelOf.getOrDefault(dep, -1) + 1);
            }
            levelOf.put(gate.id(), level);
            while (levels.size() <= level) levels.add(new ArrayList<>());
            levels.get(level).add(gate);
        }
        return levels;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
