package com.chainwright.core.llm;

import com.chainwright.core.agent.AgentDescriptor;
import com.chainwright.core.agent.AgentTask;
import com.chainwright.core.model.ContextView;
import com.chainwright.core.model.StageOutput;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the prompts for one stage: one per spawned agent and one for the orchestrator.
 * <p>
 * Every prompt carries the stage instructions, its required sections, the accepted outputs of
 * earlier stages and the project context. Agent prompts add the agent's role and any capability
 * notes; wave prompts add the current draft and the wave's focus.
 */
@Component
public class StagePromptBuilder {

    private static final String ORCHESTRATOR_SYSTEM = """
            You are the orchestrator of Chainwright, a prompt-chain planning engine.
            You turn a product idea into implementation-ready planning documents, one stage at a time.
            Write the %s document in %s.
            Use exactly one "## " heading per required section, in this order:
            %s
            Be concrete and specific to the idea. Do not restate these instructions.
            """;

    private static final String AGENT_SYSTEM = """
            You are %s, contributing to the %s document of a planning chain.
            Contribute only what your specialty adds. Use "## " headings named after the
            required sections you address, chosen from:
            %s
            Leave out sections you have nothing specific to add to.
            """;

    public StagePrompt forOrchestrator(AgentTask task, ContextView context) {
        var stage = task.stage();
        String system = String.format(ORCHESTRATOR_SYSTEM, stage.id().displayName(), stage.outputFormat(),
                bulletList(stage.requiredSections()));
        return new StagePrompt(stage.id(), null, system, userPrompt(task, context, List.of()));
    }

    public StagePrompt forAgent(AgentTask task, AgentDescriptor descriptor, ContextView context,
                                List<String> capabilityNotes) {
        var stage = task.stage();
        String system = String.format(AGENT_SYSTEM, descriptor.kind().role(), stage.id().displayName(),
                bulletList(stage.requiredSections()));
        return new StagePrompt(stage.id(), descriptor.kind(), system, userPrompt(task, context, capabilityNotes));
    }

    private String userPrompt(AgentTask task, ContextView context, List<String> capabilityNotes) {
        var sb = new StringBuilder();
        sb.append(String.format("""
                ## Idea
                %s

                ## Stage
                %s
                """, task.idea(), task.stage().instructions()));

        for (StageOutput previous : task.previousOutputs()) {
            sb.append(String.format("""

                    ## Accepted %s
                    %s
                    """, previous.stage().displayName(), previous.content()));
        }

        sb.append("\n## Project context\n").append(context.describe());

        if (task.wavePhase() != null) {
            sb.append(String.format("""

                    ## Wave
                    This is the %s wave. Build on the draft below instead of starting over.
                    """, task.wavePhase().name().toLowerCase()));
            if (!task.draft().isBlank()) {
                sb.append("\n### Current draft\n").append(task.draft()).append('\n');
            }
        }

        if (!capabilityNotes.isEmpty()) {
            sb.append("\n## Capability notes\n");
            for (String note : capabilityNotes) {
                sb.append("- ").append(note).append('\n');
            }
        }
        return sb.toString();
    }

    private static String bulletList(List<String> items) {
        if (items.isEmpty()) return "- (no fixed sections)";
        var sb = new StringBuilder();
        for (String item : items) {
            if (sb.length() > 0) sb.append('\n');
            sb.append("- ").append(item);
        }
        return sb.toString();
    }
}
