package com.prodomme.providers.chat;

import com.prodomme.models.Message;
import com.prodomme.models.ModelResponse;

import java.util.List;

/**
 * Interface for LLM chat backends.
 * Each implementation translates the vendor-neutral conversation into one vendor's
 * wire format and maps the reply back to a {@link ModelResponse}.
 */
public interface ChatProvider {

    /**
     * Get the provider name this implementation handles.
     */
    String getProviderName();

    /**
     * Send the conversation and get the model's reply.
     *
     * @param messages full conversation history, oldest first
     * @param systemMessage system prompt, or null for none
     * @return the normalized reply
     */
    ModelResponse query(List<Message> messages, String systemMessage)
        throws InferenceException, InterruptedException;
}
