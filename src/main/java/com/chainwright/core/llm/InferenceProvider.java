package com.chainwright.core.llm;

import com.chainwright.core.model.ContextView;

/**
 * External inference collaborator that turns a stage prompt into stage content.
 */
public interface InferenceProvider {

    /**
     * Generates content for the prompt.
     *
     * @param prompt  the rendered prompt
     * @param context read-only project context the prompt was built against
     * @return generated markdown content, never blank
     * @throws InferenceException if the provider fails or returns nothing
     */
    String generate(StagePrompt prompt, ContextView context);
}
