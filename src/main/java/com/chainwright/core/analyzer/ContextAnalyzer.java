package com.chainwright.core.analyzer;

import com.chainwright.core.config.ChainwrightProperties;
import com.chainwright.core.model.Domain;
import com.chainwright.core.model.ProjectContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks a project directory and builds a weighted {@link ProjectContext} snapshot.
 * <p>
 * Four signal groups are combined per domain: file extensions, directory names, content
 * keywords and framework markers (see {@link DomainSignals} for weights). Common build-tool,
 * vendor and IDE directories are excluded. The walk is depth-bounded and content scanning is
 * capped by file size and file count. Subtrees or files that cannot be read contribute nothing
 * and are listed in {@link ProjectContext#skippedSubtrees()}.
 */
@Service
public class ContextAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ContextAnalyzer.class);

    /** Directories to skip during the walk. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn", ".next", "vendor", ".venv"
    );

    /** Individual files to skip during the walk. */
    private static final Set<String> IGNORE_FILES = Set.of(
            ".DS_Store", "Thumbs.db"
    );

    private final ChainwrightProperties.Analyzer config;

    public ContextAnalyzer(ChainwrightProperties properties) {
        this.config = properties.getAnalyzer();
    }

    /**
     * Analyses the given project root and returns version 1 of its context.
     *
     * @param projectRoot the root directory of the target project
     * @return the weighted context snapshot
     * @throws ContextAnalysisException if the root is missing, unreadable or contains no files
     */
    public ProjectContext analyze(Path projectRoot) {
        return analyze(projectRoot, 1);
    }

    /**
     * Re-derives the context of a project that was analysed before. Returns {@code previous}
     * unchanged when no signal moved, otherwise a new snapshot with the next version number.
     */
    public ProjectContext reanalyze(Path projectRoot, ProjectContext previous) {
        ProjectContext fresh = analyze(projectRoot, previous.version() + 1);
        if (fresh.sameSignals(previous)) {
            log.debug("Context of {} unchanged at version {}", projectRoot, previous.version());
            return previous;
        }
        log.info("Context of {} re-derived as version {} (max domain delta {})",
                projectRoot, fresh.version(), String.format("%.3f", fresh.maxDomainDelta(previous)));
        return fresh;
    }

    private ProjectContext analyze(Path projectRoot, int version) {
        if (projectRoot == null || !Files.exists(projectRoot)) {
            throw new ContextAnalysisException("Project root does not exist: " + projectRoot);
        }
        if (!Files.isDirectory(projectRoot)) {
            throw new ContextAnalysisException("Project root is not a directory: " + projectRoot);
        }
        if (!Files.isReadable(projectRoot)) {
            throw new ContextAnalysisException("Project root is not readable: " + projectRoot);
        }

        var collector = new SignalCollector(projectRoot);
        try {
            Files.walkFileTree(projectRoot, EnumSet.noneOf(FileVisitOption.class), config.getMaxDepth(), collector);
        } catch (IOException e) {
            throw new ContextAnalysisException("Failed to walk project root " + projectRoot + ": " + e.getMessage(), e);
        }

        if (collector.fileCount == 0) {
            if (collector.skipped.contains(".")) {
                throw new ContextAnalysisException("Project root is not readable: " + projectRoot);
            }
            throw new ContextAnalysisException("Project root contains no files: " + projectRoot);
        }

        Map<Domain, Double> scores = scoreDomains(collector);
        String summary = summarize(collector, scores);
        log.info("Analysed {}: {} files, {} skipped subtrees, {}", projectRoot, collector.fileCount,
                collector.skipped.size(), summary);

        return new ProjectContext(version, projectRoot.toString(), scores, collector.extensions,
                collector.directories, collector.keywords, collector.frameworks, collector.fileCount,
                collector.skipped, summary);
    }

    private Map<Domain, Double> scoreDomains(SignalCollector c) {
        var scores = new EnumMap<Domain, Double>(Domain.class);
        for (Domain domain : Domain.values()) {
            var signals = DomainSignals.forDomain(domain);

            int extensionFiles = 0;
            for (String ext : signals.extensions()) {
                extensionFiles += c.extensions.getOrDefault(ext, 0);
            }
            double extShare = c.fileCount == 0 ? 0.0 : (double) extensionFiles / c.fileCount;
            double extScore = Math.min(1.0, DomainSignals.EXTENSION_SHARE_FACTOR * extShare);

            int dirHits = 0;
            for (String dir : signals.directories()) {
                dirHits += c.directories.getOrDefault(dir, 0);
            }
            double dirScore = DomainSignals.saturate(dirHits, DomainSignals.DIRECTORY_SATURATION);

            int keywordHits = 0;
            for (String kw : signals.keywords()) {
                keywordHits += c.keywords.getOrDefault(kw, 0);
            }
            double keywordScore = DomainSignals.saturate(keywordHits, DomainSignals.KEYWORD_SATURATION);

            int frameworkHits = 0;
            for (String fw : signals.frameworks()) {
                frameworkHits += c.frameworks.getOrDefault(fw, 0);
            }
            double frameworkScore = DomainSignals.saturate(frameworkHits, DomainSignals.FRAMEWORK_SATURATION);

            double total = DomainSignals.EXTENSION_WEIGHT * extScore
                    + DomainSignals.DIRECTORY_WEIGHT * dirScore
                    + DomainSignals.KEYWORD_WEIGHT * keywordScore
                    + DomainSignals.FRAMEWORK_WEIGHT * frameworkScore;
            scores.put(domain, Math.max(0.0, Math.min(1.0, total)));
        }
        return scores;
    }

    private String summarize(SignalCollector c, Map<Domain, Double> scores) {
        String top = scores.entrySet().stream()
                .filter(e -> e.getValue() > 0.0)
                .sorted(Map.Entry.<Domain, Double>comparingByValue().reversed())
                .limit(3)
                .map(e -> e.getKey().name().toLowerCase(Locale.ROOT) + " " + String.format("%.2f", e.getValue()))
                .collect(Collectors.joining(", "));
        return String.format("%d files; leading domains: %s", c.fileCount, top.isEmpty() ? "none" : top);
    }

    /**
     * Accumulates raw hit counts during the walk.
     */
    private final class SignalCollector extends SimpleFileVisitor<Path> {

        private final Path root;
        private final Map<String, Integer> extensions = new HashMap<>();
        private final Map<String, Integer> directories = new HashMap<>();
        private final Map<String, Integer> keywords = new HashMap<>();
        private final Map<String, Integer> frameworks = new HashMap<>();
        private final List<String> skipped = new ArrayList<>();
        private int fileCount;
        private int contentFilesRead;

        SignalCollector(Path root) {
            this.root = root;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (dir.equals(root)) return FileVisitResult.CONTINUE;
            String name = dir.getFileName().toString();
            if (IGNORE_DIRS.contains(name)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            if (!Files.isReadable(dir)) {
                recordSkipped(dir, "unreadable directory");
                return FileVisitResult.SKIP_SUBTREE;
            }
            for (String key : directoryKeys(root.relativize(dir))) {
                directories.merge(key, 1, Integer::sum);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            String name = file.getFileName().toString();
            if (IGNORE_FILES.contains(name) || !attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }
            fileCount++;
            String ext = extensionOf(name);
            if (!ext.isEmpty()) {
                extensions.merge(ext, 1, Integer::sum);
            }
            if (DomainSignals.TEXT_EXTENSIONS.contains(ext)
                    && attrs.size() <= config.getMaxContentBytes()
                    && contentFilesRead < config.getMaxContentFiles()) {
                scanContent(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            recordSkipped(file, exc instanceof AccessDeniedException ? "access denied" : exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        private void scanContent(Path file) {
            String content;
            try {
                content = Files.readString(file, StandardCharsets.UTF_8);
            } catch (MalformedInputException e) {
                log.debug("Skipping content of non UTF-8 file {}", file);
                return;
            } catch (IOException e) {
                recordSkipped(file, e.getMessage());
                return;
            }
            contentFilesRead++;
            for (String kw : DomainSignals.matchKeywords(content)) {
                keywords.merge(kw, 1, Integer::sum);
            }
            for (String fw : DomainSignals.matchFrameworks(content)) {
                frameworks.merge(fw, 1, Integer::sum);
            }
        }

        private void recordSkipped(Path path, String reason) {
            String relative = root.relativize(path).toString();
            skipped.add(relative.isEmpty() ? "." : relative);
            log.warn("Skipping unreadable path {}: {}", path, reason);
        }
    }

    /**
     * Keys a directory is counted under: every trailing run of its path segments, lower-cased, so
     * {@code src/main/db} counts for {@code db}, {@code main/db} and {@code src/main/db}.
     */
    static List<String> directoryKeys(Path relative) {
        var segments = new ArrayList<String>();
        for (Path part : relative) {
            segments.add(part.toString().toLowerCase(Locale.ROOT));
        }
        var keys = new ArrayList<String>(segments.size());
        for (int from = segments.size() - 1; from >= 0; from--) {
            keys.add(String.join("/", segments.subList(from, segments.size())));
        }
        return keys;
    }

    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) return "";
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
