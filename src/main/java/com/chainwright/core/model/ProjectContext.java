package com.chainwright.core.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable weighted snapshot of the target project, built by the context analyzer.
 * <p>
 * Re-deriving the context never mutates an existing snapshot; it produces a new one with
 * {@link #version()} incremented. Snapshots are shared by reference across concurrent agents.
 *
 * @param version            1 for the first analysis of a run, incremented on each re-derivation
 * @param rootPath           the analysed project root, empty for greenfield runs
 * @param domainScores       per-domain score in [0,1]
 * @param extensionHistogram file count per lower-case extension (without the dot)
 * @param directoryHits      hit count per matched directory pattern
 * @param keywordHits        number of files mentioning each matched keyword
 * @param frameworkHits      hit count per detected framework or import marker
 * @param fileCount          number of files considered
 * @param skippedSubtrees    paths that could not be read and contributed nothing
 * @param summary            human-readable one-liner
 */
public record ProjectContext(
    int version,
    String rootPath,
    Map<Domain, Double> domainScores,
    Map<String, Integer> extensionHistogram,
    Map<String, Integer> directoryHits,
    Map<String, Integer> keywordHits,
    Map<String, Integer> frameworkHits,
    int fileCount,
    List<String> skippedSubtrees,
    String summary
) implements Serializable {

    public ProjectContext {
        var scores = new EnumMap<Domain, Double>(Domain.class);
        for (Domain d : Domain.values()) {
            Double s = domainScores != null ? domainScores.get(d) : null;
            scores.put(d, s == null ? 0.0 : s);
        }
        domainScores = Collections.unmodifiableMap(scores);
        extensionHistogram = sorted(extensionHistogram);
        directoryHits = sorted(directoryHits);
        keywordHits = sorted(keywordHits);
        frameworkHits = sorted(frameworkHits);
        skippedSubtrees = skippedSubtrees == null ? List.of() : List.copyOf(skippedSubtrees);
        rootPath = rootPath == null ? "" : rootPath;
        summary = summary == null ? "" : summary;
    }

    /**
     * Context used for greenfield runs that have no project root.
     */
    public static ProjectContext empty() {
        return new ProjectContext(1, "", Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), 0, List.of(),
                "no project context");
    }

    public double score(Domain domain) {
        return domainScores.get(domain);
    }

    /**
     * Largest absolute per-domain score difference between this snapshot and {@code other}.
     */
    public double maxDomainDelta(ProjectContext other) {
        double max = 0.0;
        for (Domain d : Domain.values()) {
            max = Math.max(max, Math.abs(score(d) - other.score(d)));
        }
        return max;
    }

    /**
     * True when every signal matches {@code other}, ignoring version and summary.
     */
    public boolean sameSignals(ProjectContext other) {
        return other != null
                && rootPath.equals(other.rootPath)
                && domainScores.equals(other.domainScores)
                && extensionHistogram.equals(other.extensionHistogram)
                && directoryHits.equals(other.directoryHits)
                && keywordHits.equals(other.keywordHits)
                && frameworkHits.equals(other.frameworkHits)
                && fileCount == other.fileCount;
    }

    public ProjectContext withVersion(int newVersion) {
        return new ProjectContext(newVersion, rootPath, domainScores, extensionHistogram, directoryHits,
                keywordHits, frameworkHits, fileCount, skippedSubtrees, summary);
    }

    /**
     * Read-only subset handed to an agent: only the requested domains' scores plus
     * the structural histograms.
     */
    public ContextView view(Collection<Domain> domains) {
        var subset = new EnumMap<Domain, Double>(Domain.class);
        for (Domain d : domains) {
            subset.put(d, score(d));
        }
        return new ContextView(version, rootPath, subset, extensionHistogram, directoryHits, frameworkHits,
                fileCount, summary);
    }

    private static Map<String, Integer> sorted(Map<String, Integer> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new TreeMap<>(source));
    }
}
