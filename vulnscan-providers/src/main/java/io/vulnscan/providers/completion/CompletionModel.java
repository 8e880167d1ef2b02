package io.vulnscan.providers.completion;

/**
 * Text completion from a chat-style language model.
 */
public interface CompletionModel {

    /**
     * Returns the model's reply to one system + user exchange.
     */
    String complete(String systemPrompt, String userPrompt);

    String getModelId();
}
