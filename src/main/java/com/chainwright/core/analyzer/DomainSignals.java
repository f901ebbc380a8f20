package com.chainwright.core.analyzer;

import com.chainwright.core.model.Domain;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Static signal tables used by {@link ContextAnalyzer} to attribute filesystem evidence to domains.
 * <p>
 * Each domain has four signal groups: file extensions, directory names, content keywords and
 * framework/import markers. Keywords are matched on word boundaries, case-insensitively;
 * framework markers are plain substrings of the file content.
 */
public final class DomainSignals {

    public static final double EXTENSION_WEIGHT = 0.3;
    public static final double DIRECTORY_WEIGHT = 0.4;
    public static final double KEYWORD_WEIGHT = 0.2;
    public static final double FRAMEWORK_WEIGHT = 0.1;

    /** Hit counts at which each group saturates to 1.0. */
    static final double DIRECTORY_SATURATION = 3.0;
    static final double KEYWORD_SATURATION = 5.0;
    static final double FRAMEWORK_SATURATION = 2.0;

    /** A domain's extension share saturates at half of the files. */
    static final double EXTENSION_SHARE_FACTOR = 2.0;

    record Signals(
        Set<String> extensions,
        Set<String> directories,
        List<String> keywords,
        List<String> frameworks
    ) {}

    private static final Map<Domain, Signals> SIGNALS = new EnumMap<>(Domain.class);

    static {
        SIGNALS.put(Domain.FRONTEND, new Signals(
                Set.of("tsx", "jsx", "vue", "svelte", "css", "scss", "less", "html"),
                Set.of("components", "pages", "views", "ui", "frontend", "web", "public", "styles", "assets"),
                List.of("component", "react", "render", "props", "css", "layout", "responsive", "accessibility"),
                List.of("\"react\"", "\"vue\"", "\"@angular/core\"", "\"svelte\"", "\"next\"", "from 'react'")));
        SIGNALS.put(Domain.BACKEND, new Signals(
                Set.of("java", "kt", "go", "py", "rb", "cs", "rs", "sql"),
                Set.of("api", "controllers", "services", "server", "backend", "repository", "handlers", "models"),
                List.of("endpoint", "database", "repository", "controller", "transaction", "query", "rest"),
                List.of("spring-boot", "express", "django", "flask", "fastapi", "gin-gonic", "@RestController")));
        SIGNALS.put(Domain.SECURITY, new Signals(
                Set.of("pem", "key", "crt", "jks"),
                Set.of("auth", "security", "iam", "crypto", "oauth", "permissions"),
                List.of("authentication", "authorization", "token", "password", "encrypt", "oauth", "jwt", "csrf"),
                List.of("spring-security", "passport", "jsonwebtoken", "bcrypt", "keycloak")));
        SIGNALS.put(Domain.PERFORMANCE, new Signals(
                Set.of("jmx", "k6"),
                Set.of("benchmark", "benchmarks", "perf", "load-tests", "profiling", "cache"),
                List.of("latency", "throughput", "cache", "benchmark", "performance", "scalability"),
                List.of("jmh", "gatling", "k6", "locust", "redis")));
        SIGNALS.put(Domain.ARCHITECTURE, new Signals(
                Set.of("puml", "drawio", "adr"),
                Set.of("architecture", "adr", "design", "infrastructure", "deploy", "helm", "modules"),
                List.of("architecture", "microservice", "module", "integration", "boundary", "event-driven"),
                List.of("docker-compose", "kubernetes", "terraform", "helm")));
        SIGNALS.put(Domain.ANALYSIS, new Signals(
                Set.of("ipynb", "csv", "parquet"),
                Set.of("analysis", "research", "notebooks", "data", "reports", "metrics"),
                List.of("analysis", "requirement", "risk", "assumption", "dataset", "metric"),
                List.of("pandas", "numpy", "jupyter")));
        SIGNALS.put(Domain.DOCUMENTATION, new Signals(
                Set.of("md", "adoc", "rst", "txt"),
                Set.of("docs", "doc", "documentation", "wiki", "guides"),
                List.of("readme", "guide", "tutorial", "documentation", "changelog"),
                List.of("mkdocs", "docusaurus", "sphinx", "asciidoctor")));
    }

    /** File extensions whose content is worth scanning for keywords and markers. */
    static final Set<String> TEXT_EXTENSIONS = Set.of(
            "java", "kt", "go", "py", "rb", "cs", "rs", "sql", "js", "ts", "tsx", "jsx", "vue", "svelte",
            "html", "css", "scss", "less", "md", "adoc", "rst", "txt", "json", "yml", "yaml", "toml",
            "xml", "gradle", "properties", "ipynb", "puml");

    private static final Map<String, Pattern> KEYWORD_PATTERNS = new TreeMap<>();

    static {
        for (Signals s : SIGNALS.values()) {
            for (String kw : s.keywords()) {
                KEYWORD_PATTERNS.computeIfAbsent(kw,
                        k -> Pattern.compile("\\b" + Pattern.quote(k) + "\\b", Pattern.CASE_INSENSITIVE));
            }
        }
    }

    private DomainSignals() {} // utility class

    static Signals forDomain(Domain domain) {
        return SIGNALS.get(domain);
    }

    /**
     * Returns the keywords of any domain that appear in the text on a word boundary.
     */
    static List<String> matchKeywords(String text) {
        var matched = new ArrayList<String>();
        if (text == null || text.isEmpty()) return matched;
        for (var entry : KEYWORD_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                matched.add(entry.getKey());
            }
        }
        return matched;
    }

    /**
     * Returns the framework markers of any domain contained in the text.
     */
    static List<String> matchFrameworks(String text) {
        var matched = new ArrayList<String>();
        if (text == null || text.isEmpty()) return matched;
        for (Signals s : SIGNALS.values()) {
            for (String marker : s.frameworks()) {
                if (text.contains(marker) && !matched.contains(marker)) {
                    matched.add(marker);
                }
            }
        }
        return matched;
    }

    static double saturate(double hits, double saturation) {
        return Math.min(1.0, hits / saturation);
    }
}
