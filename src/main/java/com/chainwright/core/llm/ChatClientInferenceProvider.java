package com.chainwright.core.llm;

import com.chainwright.core.model.ContextView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link InferenceProvider} backed by Spring AI's {@link ChatClient}.
 */
@Service
public class ChatClientInferenceProvider implements InferenceProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatClientInferenceProvider.class);

    private final ChatClient chatClient;

    public ChatClientInferenceProvider(ChatClient.Builder builder,
                                       @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("ChatClientInferenceProvider initialized, OpenAI base-url: {}", baseUrl);
    }

    @Override
    public String generate(StagePrompt prompt, ContextView context) {
        log.info("Inference started for {} at {}", prompt.caller(), prompt.stage());
        long start = System.currentTimeMillis();
        String response;
        try {
            response = chatClient.prompt()
                    .system(prompt.system())
                    .user(prompt.user())
                    .call()
                    .content();
        } catch (Exception e) {
            throw new InferenceException("Inference failed for " + prompt.caller() + " at " + prompt.stage()
                    + ": " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("Inference complete for {} at {} ({}s)", prompt.caller(), prompt.stage(),
                String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new InferenceException("Inference returned empty content for " + prompt.caller()
                    + " at " + prompt.stage() + ". Check that the model is running.");
        }
        return stripFences(response);
    }

    /**
     * Removes a markdown code fence wrapping the whole response.
     */
    static String stripFences(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```markdown")) {
            cleaned = cleaned.substring(11);
        } else if (cleaned.startsWith("```md")) {
            cleaned = cleaned.substring(5);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        } else {
            return cleaned;
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
