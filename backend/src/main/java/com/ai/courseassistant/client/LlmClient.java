package com.ai.courseassistant.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Component;

/**
 * LlmClient is the single entry point to the generative model.
 *
 * Each call carries its own sampling temperature and token ceiling; the
 * underlying provider is whatever ChatModel backs the {@link ChatClient}
 * bean (Ollama, see {@link com.ai.courseassistant.config.RagConfig}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClient {

    private final ChatClient chatClient;

    /**
     * Sends a prompt and returns the raw text response.
     *
     * @param prompt      the fully rendered prompt
     * @param temperature sampling temperature
     * @param maxTokens   ceiling on generated tokens
     * @return AI-generated text, never null
     */
    public String complete(String prompt, double temperature, int maxTokens) {
        log.debug("Sending prompt to LLM: chars={}, temperature={}, maxTokens={}",
                prompt.length(), temperature, maxTokens);

        String content = chatClient.prompt()
                .user(prompt)
                .options(ChatOptions.builder()
                        .temperature(temperature)
                        .maxTokens(maxTokens)
                        .build())
                .call()
                .content();

        return content == null ? "" : content;
    }
}
