package com.ai.courseassistant.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RagConfig wires the Spring AI ChatClient to Ollama explicitly.
 *
 * The client is shared by every request; temperature and token ceiling are
 * supplied per call by {@link com.ai.courseassistant.client.LlmClient}, so the
 * defaults configured under {@code spring.ai.ollama.chat.options.*} only apply
 * to calls that do not override them.
 */
@Configuration
public class RagConfig {

    /**
     * Creates a ChatClient backed by the local Ollama model.
     *
     * @param ollamaChatModel injected automatically by Spring AI Ollama auto-config
     * @return a ChatClient that sends prompts to Ollama
     */
    @Bean
    public ChatClient chatClient(OllamaChatModel ollamaChatModel) {
        return ChatClient.builder(ollamaChatModel).build();
    }
}
