package com.chainwright.core.agent;

import com.chainwright.core.llm.InferenceProvider;
import com.chainwright.core.llm.StagePromptBuilder;
import com.chainwright.mcp.CapabilityCall;
import com.chainwright.mcp.CapabilityInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Map;

/**
 * {@link AgentExecutor} that gathers the descriptor's capabilities through MCP and then asks the
 * inference provider for the agent's contribution.
 */
@Component
public class InferenceAgentExecutor implements AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(InferenceAgentExecutor.class);

    static final int MAX_NOTE_LENGTH = 2000;

    private final InferenceProvider inferenceProvider;
    private final StagePromptBuilder promptBuilder;
    private final CapabilityInvoker capabilityInvoker;

    public InferenceAgentExecutor(InferenceProvider inferenceProvider, StagePromptBuilder promptBuilder,
                                  CapabilityInvoker capabilityInvoker) {
        this.inferenceProvider = inferenceProvider;
        this.promptBuilder = promptBuilder;
        this.capabilityInvoker = capabilityInvoker;
    }

    @Override
    public AgentOutput execute(AgentInstance instance) throws InterruptedException {
        var task = instance.task();
        var notes = new ArrayList<String>();
        boolean confidenceReduced = false;

        for (String capability : instance.descriptor().mcpCapabilityTags()) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Agent " + instance.id() + " cancelled");
            }
            var response = capabilityInvoker.invoke(new CapabilityCall(task.runId(), instance.id(), instance.kind(),
                    capability, Map.of(
                            "query", task.workingText(),
                            "stage", task.stage().id().name(),
                            "agent", instance.kind().name())));
            if (response.degraded()) {
                confidenceReduced = true;
                notes.add(capability + ": unavailable, proceed with direct analysis");
                continue;
            }
            confidenceReduced |= response.confidenceReduced();
            notes.add(capability + " (" + response.servedCapability() + "): " + truncate(response.result()));
        }

        if (Thread.interrupted()) {
            throw new InterruptedException("Agent " + instance.id() + " cancelled");
        }
        var prompt = promptBuilder.forAgent(task, instance.descriptor(), instance.context(), notes);
        String content = inferenceProvider.generate(prompt, instance.context());
        log.debug("Agent {} produced {} chars", instance.id(), content.length());
        return new AgentOutput(content, confidenceReduced, notes);
    }

    private static String truncate(String text) {
        String t = text.strip();
        return t.length() > MAX_NOTE_LENGTH ? t.substring(0, MAX_NOTE_LENGTH) + "..." : t;
    }
}
