package com.chainwright.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable, agent-facing subset of a {@link ProjectContext}.
 */
public record ContextView(
    int contextVersion,
    String rootPath,
    Map<Domain, Double> domainScores,
    Map<String, Integer> extensionHistogram,
    Map<String, Integer> directoryHits,
    Map<String, Integer> frameworkHits,
    int fileCount,
    String summary
) {
    public ContextView {
        domainScores = domainScores == null || domainScores.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(domainScores));
        extensionHistogram = copy(extensionHistogram);
        directoryHits = copy(directoryHits);
        frameworkHits = copy(frameworkHits);
    }

    /**
     * Renders the view as a compact prompt section.
     */
    public String describe() {
        var sb = new StringBuilder();
        sb.append("Project: ").append(summary).append('\n');
        if (!domainScores.isEmpty()) {
            sb.append("Domain signals:");
            domainScores.forEach((d, s) -> sb.append(' ').append(d.name().toLowerCase())
                    .append('=').append(String.format("%.2f", s)));
            sb.append('\n');
        }
        if (!frameworkHits.isEmpty()) {
            sb.append("Frameworks: ").append(String.join(", ", frameworkHits.keySet())).append('\n');
        }
        return sb.toString();
    }

    private static Map<String, Integer> copy(Map<String, Integer> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new TreeMap<>(source));
    }
}
