package com.chainwright.core.qualitygate;

import com.chainwright.core.model.StageId;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Results of one gate evaluation pass over a stage output.
 *
 * @param stage    the evaluated stage
 * @param strategy the strategy that ran
 * @param results  gate results in evaluation (dependency) order
 * @param notRun   gates skipped by a sequential fail-fast stop
 */
public record GateReport(
    StageId stage,
    GateExecutionStrategy strategy,
    List<GateResult> results,
    List<String> notRun
) implements Serializable {
    public GateReport {
        results = results == null ? List.of() : List.copyOf(results);
        notRun = notRun == null ? List.of() : List.copyOf(notRun);
    }

    /** Required gates that failed or were blocked. */
    public List<GateResult> blocking() {
        return results.stream().filter(GateResult::blocking).toList();
    }

    public boolean isBlocking() {
        return results.stream().anyMatch(GateResult::blocking);
    }

    public List<GateResult> warnings() {
        return results.stream().filter(r -> r.status() == GateStatus.WARNING).toList();
    }

    public Optional<GateResult> result(String gateId) {
        return results.stream().filter(r -> r.gateId().equals(gateId)).findFirst();
    }

    public String summary() {
        var sb = new StringBuilder();
        for (var r : results) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(r.gateId()).append('=').append(r.status())
              .append(String.format(" (%.2f/%.2f)", r.score(), r.threshold()));
        }
        if (!notRun.isEmpty()) {
            sb.append("; not run: ").append(notRun);
        }
        return sb.toString();
    }
}
