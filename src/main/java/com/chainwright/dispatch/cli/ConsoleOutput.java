package com.chainwright.dispatch.cli;

import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.qualitygate.GateResult;
import com.chainwright.core.qualitygate.GateStatus;
import com.chainwright.mcp.ServerStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Chainwright CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CHAINWRIGHT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CHAINWRIGHT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void stage(String stage, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [" + stage + "]|@ " + message));
    }

    public static void gate(GateResult result) {
        String color = switch (result.status()) {
            case PASSED -> "fg(green)";
            case WARNING -> "fg(yellow)";
            case FAILED, BLOCKED -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|%s %-7s|@ %s %.2f/%.2f%s", color, result.status(), result.gateId(),
                result.score(), result.threshold(), result.required() ? "" : " (optional)")));
        if (result.status() != GateStatus.PASSED) {
            for (String finding : result.findings()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "    @|fg(red) -|@ " + finding));
            }
        }
    }

    public static void server(ServerStatus status) {
        String health = switch (status.health()) {
            case HEALTHY -> "@|fg(green) HEALTHY  |@";
            case UNHEALTHY -> "@|fg(red) UNHEALTHY|@";
            case UNKNOWN -> "@|fg(white) UNKNOWN  |@";
        };
        var d = status.descriptor();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %s %-16s prio %-4d leases %d/%d  success %.0f%%  latency %.0fms  %s",
                health, d.id(), d.priority(), status.activeLeases(), d.maxConcurrentLeases(),
                status.successRate() * 100, status.averageLatencyMs(), d.capabilityTags())));
    }

    public static void watchEvent(ChainEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.created" -> "@|fg(cyan) [RUN]|@";
            case "stage.entered", "stage.advanced" -> "@|bold,fg(yellow) [STAGE]|@";
            case "agents.scored", "scoring.ambiguity" -> "@|fg(blue) [SCORING]|@";
            case "agent.spawned", "agent.completed" -> "@|fg(blue) [AGENT]|@";
            case "agent.failed" -> "@|fg(red) [AGENT]|@";
            case "wave.assessed" -> "@|fg(magenta) [WAVE]|@";
            case "wave.miscalculation" -> "@|fg(red) [WAVE]|@";
            case "gates.evaluated" -> "@|fg(yellow) [GATES]|@";
            case "remediation.requested" -> "@|fg(red),bold [REMEDIATION]|@";
            case "capability.fallback" -> "@|fg(magenta) [MCP]|@";
            case "run.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "run.failed", "run.aborted" -> "@|fg(red),bold [STOPPED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + event.eventType() + " "
                + (event.stage() != null ? event.stage() + " " : "") + event.payload()));
    }
}
