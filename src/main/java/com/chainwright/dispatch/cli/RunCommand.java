package com.chainwright.dispatch.cli;

import com.chainwright.core.agent.AgentKind;
import com.chainwright.core.engine.PromptChainEngine;
import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.model.ChainRun;
import com.chainwright.core.model.RunStatus;
import com.chainwright.core.model.StageId;
import com.chainwright.core.model.StageOutput;
import com.chainwright.core.model.UserPreferences;
import com.chainwright.core.qualitygate.GateExecutionStrategy;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * CLI command: chainwright run "&lt;idea&gt;"
 * <p>
 * Drives an idea through the whole chain and prints the outcome. When a required gate blocks,
 * the blocking report is printed and, with {@code --revise}, the given file is submitted once as
 * the remediated content of the blocked stage.
 * <p>
 * Exit codes: 0 completed, 2 waiting for remediation, 1 failed or aborted.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run an idea through the prompt chain")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Free-form idea to plan")
    private String idea;

    @Option(names = {"--project", "-p"}, description = "Project directory to analyse for context")
    private Path project;

    @Option(names = "--prefer", description = "Agent to favour (repeatable): ${COMPLETION-CANDIDATES}")
    private List<AgentKind> preferred = List.of();

    @Option(names = "--exclude", description = "Agent never to spawn (repeatable): ${COMPLETION-CANDIDATES}")
    private List<AgentKind> excluded = List.of();

    @Option(names = {"--gates", "-g"}, description = "Gate strategy: ${COMPLETION-CANDIDATES}")
    private GateExecutionStrategy gateStrategy;

    @Option(names = {"--out", "-o"}, description = "Write the accepted stage outputs to this file")
    private Path out;

    @Option(names = "--revise", description = "Revised content submitted if a stage blocks on its gates")
    private Path revision;

    @Option(names = {"--watch", "-w"}, description = "Print run events as they happen")
    private boolean watch;

    @Option(names = "--watch-stage", description = "Print only the events of this stage: ${COMPLETION-CANDIDATES}")
    private StageId watchStage;

    private final PromptChainEngine engine;
    private final EventBus eventBus;

    public RunCommand(PromptChainEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        UserPreferences prefs;
        try {
            prefs = new UserPreferences(toSet(preferred), toSet(excluded));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        String runId = engine.generateRunId();
        var subscription = eventBus.subscribe(runId, eventFilter(), ConsoleOutput::watchEvent);
        try {
            ConsoleOutput.info("Run " + runId + " started");
            var run = engine.start(runId, idea, project, prefs, gateStrategy);

            if (run.awaitingRemediation() && revision != null) {
                printRemediation(run);
                ConsoleOutput.info("Submitting " + revision + " as revised " + run.currentStage().displayName());
                run = engine.remediate(runId, Files.readString(revision, StandardCharsets.UTF_8));
            }
            return report(run);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + revision + ": " + e.getMessage());
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            subscription.unsubscribe();
        }
    }

    /** Every event with --watch, one stage's events with --watch-stage, otherwise only warnings. */
    Predicate<ChainEvent> eventFilter() {
        if (watchStage != null) return ChainEvent.forStage(watchStage);
        if (watch) return e -> true;
        return ChainEvent::isWarning;
    }

    private int report(ChainRun run) throws IOException {
        System.out.println();
        for (StageOutput output : run.outputs()) {
            ConsoleOutput.stage(output.stage().displayName(), String.format("accepted (%d chars, contributors %s%s%s)",
                    output.content().length(), output.contributors(),
                    output.remediated() ? ", remediated" : "",
                    output.confidenceReduced() ? ", reduced confidence" : ""));
        }
        for (var suggestion : run.suggestions()) {
            ConsoleOutput.info(String.format("Suggested for %s: %s (%.2f)", suggestion.stage().displayName(),
                    suggestion.agent(), suggestion.score()));
        }
        if (!run.errors().isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + run.errors().size() + "):");
            for (var e : run.errors()) {
                ConsoleOutput.error("  " + e);
            }
        }
        if (out != null && !run.outputs().isEmpty()) {
            Files.writeString(out, render(run), StandardCharsets.UTF_8);
            ConsoleOutput.success("Wrote " + run.outputs().size() + " stage output(s) to " + out);
        }

        System.out.println();
        if (run.status() == RunStatus.COMPLETED) {
            ConsoleOutput.success("Chain complete.");
            return 0;
        }
        if (run.awaitingRemediation()) {
            printRemediation(run);
            ConsoleOutput.info("Run waits for remediation of " + run.currentStage().displayName() + ".");
            return 2;
        }
        ConsoleOutput.error("Run " + run.status() + ": " + run.failureReason());
        return 1;
    }

    private static void printRemediation(ChainRun run) {
        ConsoleOutput.warn("Gates blocked " + run.currentStage().displayName() + ":");
        for (var result : run.pendingRemediation().results()) {
            ConsoleOutput.gate(result);
        }
    }

    static String render(ChainRun run) {
        var sb = new StringBuilder();
        sb.append("# ").append(run.idea().lines().findFirst().orElse(run.runId())).append('\n');
        for (StageOutput output : run.outputs()) {
            sb.append("\n# ").append(output.stage().displayName()).append("\n\n")
              .append(output.content().strip()).append('\n');
        }
        return sb.toString();
    }

    private static EnumSet<AgentKind> toSet(List<AgentKind> kinds) {
        var set = EnumSet.noneOf(AgentKind.class);
        if (kinds != null) set.addAll(kinds);
        return set;
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
