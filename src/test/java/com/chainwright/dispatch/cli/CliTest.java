package com.chainwright.dispatch.cli;

import com.chainwright.core.agent.AgentKind;
import com.chainwright.core.engine.PromptChainEngine;
import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.model.ChainRun;
import com.chainwright.core.model.ProjectContext;
import com.chainwright.core.model.RunStatus;
import com.chainwright.core.model.StageId;
import com.chainwright.core.model.StageOutput;
import com.chainwright.core.qualitygate.GateExecutionStrategy;
import com.chainwright.core.qualitygate.GateReport;
import com.chainwright.core.qualitygate.GateResult;
import com.chainwright.core.qualitygate.GateStatus;
import com.chainwright.mcp.CapabilityTransport;
import com.chainwright.mcp.McpHealthMonitor;
import com.chainwright.mcp.McpServerDescriptor;
import com.chainwright.mcp.ServerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the Chainwright CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    private static final String RUN_ID = "CHN-2026-0001";

    private record CliResult(int exitCode, String output) {}

    private PromptChainEngine engine;
    private EventBus eventBus;
    private ServerRegistry registry;

    @BeforeEach
    void setUp() {
        engine = mock(PromptChainEngine.class);
        when(engine.generateRunId()).thenReturn(RUN_ID);
        eventBus = new EventBus();
        registry = new ServerRegistry(List.of(), 10);
    }

    private static ChainRun run(RunStatus status, List<StageOutput> outputs, GateReport pending, String reason) {
        return new ChainRun(RUN_ID, "Team dashboard", status,
                outputs.isEmpty() ? StageId.IDEA_DEFINITION : outputs.get(outputs.size() - 1).stage(),
                outputs, ProjectContext.empty(), null, pending, List.of(), List.of(), List.of(), reason, Instant.now());
    }

    private static StageOutput output(StageId stage, String content, boolean remediated) {
        return new StageOutput(stage, content, List.of("ANALYZER"), false, remediated);
    }

    private static GateReport blockingReport() {
        return new GateReport(StageId.IDEA_DEFINITION, GateExecutionStrategy.ADAPTIVE, List.of(
                new GateResult("structure", GateStatus.FAILED, 0.33, 0.8, true, Map.of(),
                        List.of("missing section: Target Users"), 3)), List.of());
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(engine, eventBus);
                }
                if (cls == ServersCommand.class) {
                    return (K) new ServersCommand(registry,
                            new McpHealthMonitor(registry, mock(CapabilityTransport.class), false));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new ChainwrightCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output
    // =====================================================================

    @Nested
    @DisplayName("help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void help() {
            var result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("servers"));
            assertTrue(result.output().contains("Prompt-chain orchestration engine"));
        }

        @Test
        @DisplayName("--version shows the version")
        void version() {
            var result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Chainwright 0.1.0"));
        }

        @Test
        @DisplayName("run --help shows the run options")
        void runHelp() {
            var result = execute("run", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--project"));
            assertTrue(result.output().contains("--revise"));
            assertTrue(result.output().contains("--gates"));
        }
    }

    // =====================================================================
    //  run
    // =====================================================================

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("a completed chain exits 0")
        void completed() {
            when(engine.start(eq(RUN_ID), eq("Team dashboard"), isNull(), any(), isNull()))
                    .thenReturn(run(RunStatus.COMPLETED, List.of(output(StageId.USER_STORY, "## Stories", false)),
                            null, ""));

            var result = execute("run", "Team dashboard");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("Chain complete."));
        }

        @Test
        @DisplayName("options reach the engine as preferences and a gate strategy")
        void options(@TempDir Path dir) {
            when(engine.start(anyString(), anyString(), any(), any(), any()))
                    .thenReturn(run(RunStatus.COMPLETED, List.of(), null, ""));

            execute("run", "Team dashboard", "--project", dir.toString(), "--prefer", "SECURITY",
                    "--exclude", "FRONTEND", "--gates", "SEQUENTIAL");

            verify(engine).start(eq(RUN_ID), eq("Team dashboard"), eq(dir),
                    argThat(p -> p.prefers(AgentKind.SECURITY)
                            && p.excludes(AgentKind.FRONTEND)),
                    eq(GateExecutionStrategy.SEQUENTIAL));
        }

        @Test
        @DisplayName("an agent both preferred and excluded is rejected before the run starts")
        void conflictingPreferences() {
            var result = execute("run", "Team dashboard", "--prefer", "SCRIBE", "--exclude", "SCRIBE");

            assertEquals(1, result.exitCode());
            verify(engine, never()).start(anyString(), anyString(), any(), any(), any());
        }

        @Test
        @DisplayName("a blocked stage prints the gate report and exits 2")
        void blocked() {
            when(engine.start(anyString(), anyString(), any(), any(), any()))
                    .thenReturn(run(RunStatus.IN_PROGRESS, List.of(), blockingReport(), ""));

            var result = execute("run", "Team dashboard");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("missing section: Target Users"));
            assertTrue(result.output().contains("waits for remediation"));
        }

        @Test
        @DisplayName("--revise submits the file once when a stage blocks")
        void revise(@TempDir Path dir) throws Exception {
            Path revision = Files.writeString(dir.resolve("idea.md"), "## Problem Statement\n\nrevised");
            when(engine.start(anyString(), anyString(), any(), any(), any()))
                    .thenReturn(run(RunStatus.IN_PROGRESS, List.of(), blockingReport(), ""));
            when(engine.remediate(RUN_ID, "## Problem Statement\n\nrevised"))
                    .thenReturn(run(RunStatus.COMPLETED,
                            List.of(output(StageId.IDEA_DEFINITION, "## Problem Statement\n\nrevised", true)), null, ""));

            var result = execute("run", "Team dashboard", "--revise", revision.toString());

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("remediated"));
            verify(engine).remediate(RUN_ID, "## Problem Statement\n\nrevised");
        }

        @Test
        @DisplayName("a failed run exits 1 with its reason")
        void failed() {
            when(engine.start(anyString(), anyString(), any(), any(), any()))
                    .thenReturn(run(RunStatus.FAILED, List.of(), null, "Inference failed: timeout"));

            var result = execute("run", "Team dashboard");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Inference failed: timeout"));
        }

        @Test
        @DisplayName("an engine exception exits 1 with the root cause")
        void engineError() {
            when(engine.start(anyString(), anyString(), any(), any(), any()))
                    .thenThrow(new IllegalStateException("wrapper", new IllegalArgumentException("root cause")));

            var result = execute("run", "Team dashboard");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("root cause"));
        }

        @Test
        @DisplayName("--watch-stage prints that stage's events and the run ends unsubscribed")
        void watchStage() {
            when(engine.start(anyString(), anyString(), any(), any(), any())).thenAnswer(inv -> {
                eventBus.publish(ChainEvent.of("stage.entered", RUN_ID, "PRD", Map.of("marker", "prd-entered")));
                eventBus.publish(ChainEvent.of("stage.entered", RUN_ID, "TRD", Map.of("marker", "trd-entered")));
                return run(RunStatus.COMPLETED, List.of(), null, "");
            });

            var result = execute("run", "Team dashboard", "--watch-stage", "TRD");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("trd-entered"));
            assertFalse(result.output().contains("prd-entered"));
            assertEquals(0, eventBus.subscriberCount(RUN_ID));
        }

        @Test
        @DisplayName("without --watch only warning events are printed")
        void warningsOnly() {
            when(engine.start(anyString(), anyString(), any(), any(), any())).thenAnswer(inv -> {
                eventBus.publish(ChainEvent.of("agents.scored", RUN_ID, "PRD", Map.of("marker", "scored")));
                eventBus.publish(ChainEvent.of("wave.miscalculation", RUN_ID, "PRD", Map.of("marker", "recalculated")));
                return run(RunStatus.COMPLETED, List.of(), null, "");
            });

            var result = execute("run", "Team dashboard");

            assertTrue(result.output().contains("recalculated"));
            assertFalse(result.output().contains("scored"));
        }

        @Test
        @DisplayName("--out writes the accepted outputs as one markdown document")
        void out(@TempDir Path dir) throws Exception {
            Path out = dir.resolve("chain.md");
            when(engine.start(anyString(), anyString(), any(), any(), any()))
                    .thenReturn(run(RunStatus.COMPLETED, List.of(
                            output(StageId.IDEA_DEFINITION, "## Problem Statement\n\nslow reviews", false),
                            output(StageId.PRD, "## Overview\n\ndashboard", false)), null, ""));

            assertEquals(0, execute("run", "Team dashboard", "--out", out.toString()).exitCode());

            String written = Files.readString(out);
            assertTrue(written.startsWith("# Team dashboard\n"));
            assertTrue(written.indexOf("# Idea Definition") < written.indexOf("# Product Requirements"));
        }
    }

    // =====================================================================
    //  servers
    // =====================================================================

    @Nested
    @DisplayName("servers")
    class ServersTests {

        @Test
        @DisplayName("an empty registry says capabilities use their fallbacks")
        void empty() {
            var result = execute("servers");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No MCP servers configured"));
        }

        @Test
        @DisplayName("configured servers are listed with their health")
        void listed() {
            registry = new ServerRegistry(List.of(McpServerDescriptor.of("docs", List.of("documentation"), 1, 2)), 10);

            var result = execute("servers");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("docs"));
            assertTrue(result.output().contains("UNKNOWN"));
            assertTrue(result.output().contains("No unhealthy servers"));
        }
    }
}
