package com.chainwright.core.config;

import com.chainwright.core.qualitygate.GateExecutionStrategy;
import com.chainwright.core.scoring.BoundaryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "chainwright")
public class ChainwrightProperties {

    private Coordinator coordinator = new Coordinator();
    private Scoring scoring = new Scoring();
    private Wave wave = new Wave();
    private Gates gates = new Gates();
    private Analyzer analyzer = new Analyzer();
    private Catalog catalog = new Catalog();

    public Coordinator getCoordinator() { return coordinator; }
    public void setCoordinator(Coordinator coordinator) { this.coordinator = coordinator; }
    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring scoring) { this.scoring = scoring; }
    public Wave getWave() { return wave; }
    public void setWave(Wave wave) { this.wave = wave; }
    public Gates getGates() { return gates; }
    public void setGates(Gates gates) { this.gates = gates; }
    public Analyzer getAnalyzer() { return analyzer; }
    public void setAnalyzer(Analyzer analyzer) { this.analyzer = analyzer; }
    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }

    public static class Coordinator {
        private int maxConcurrentAgents = 4;
        private int instanceTimeoutSeconds = 300;
        private int cancelGraceSeconds = 5;
        /** Attempts per agent instance, including the first one. */
        private int maxAttempts = 2;

        public int getMaxConcurrentAgents() { return maxConcurrentAgents; }
        public void setMaxConcurrentAgents(int maxConcurrentAgents) { this.maxConcurrentAgents = maxConcurrentAgents; }
        public int getInstanceTimeoutSeconds() { return instanceTimeoutSeconds; }
        public void setInstanceTimeoutSeconds(int instanceTimeoutSeconds) { this.instanceTimeoutSeconds = instanceTimeoutSeconds; }
        public int getCancelGraceSeconds() { return cancelGraceSeconds; }
        public void setCancelGraceSeconds(int cancelGraceSeconds) { this.cancelGraceSeconds = cancelGraceSeconds; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class Scoring {
        private double autoSpawnThreshold = 0.85;
        private double suggestThreshold = 0.70;
        private BoundaryPolicy boundaryPolicy = BoundaryPolicy.INCLUSIVE;

        public double getAutoSpawnThreshold() { return autoSpawnThreshold; }
        public void setAutoSpawnThreshold(double autoSpawnThreshold) { this.autoSpawnThreshold = autoSpawnThreshold; }
        public double getSuggestThreshold() { return suggestThreshold; }
        public void setSuggestThreshold(double suggestThreshold) { this.suggestThreshold = suggestThreshold; }
        public BoundaryPolicy getBoundaryPolicy() { return boundaryPolicy; }
        public void setBoundaryPolicy(BoundaryPolicy boundaryPolicy) { this.boundaryPolicy = boundaryPolicy; }
    }

    public static class Wave {
        private double threshold = 0.7;
        private double contextDeltaThreshold = 0.15;

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
        public double getContextDeltaThreshold() { return contextDeltaThreshold; }
        public void setContextDeltaThreshold(double contextDeltaThreshold) { this.contextDeltaThreshold = contextDeltaThreshold; }
    }

    public static class Gates {
        private GateExecutionStrategy strategy = GateExecutionStrategy.ADAPTIVE;
        private int parallelism = 4;

        public GateExecutionStrategy getStrategy() { return strategy; }
        public void setStrategy(GateExecutionStrategy strategy) { this.strategy = strategy; }
        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    }

    public static class Analyzer {
        private int maxDepth = 8;
        private long maxContentBytes = 256 * 1024;
        private int maxContentFiles = 2000;

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
        public long getMaxContentBytes() { return maxContentBytes; }
        public void setMaxContentBytes(long maxContentBytes) { this.maxContentBytes = maxContentBytes; }
        public int getMaxContentFiles() { return maxContentFiles; }
        public void setMaxContentFiles(int maxContentFiles) { this.maxContentFiles = maxContentFiles; }
    }

    public static class Catalog {
        private String location = "classpath:chain-catalog.json";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }
}
