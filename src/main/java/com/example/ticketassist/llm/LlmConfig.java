package com.example.ticketassist.llm;

import java.util.Map;

import org.springframework.ai.chat.model.ChatModel;

final class LlmConfig {

    static final Map<String, String> PROVIDER_SERVERS = Map.of(
        "openai", "api.openai.com",
        "anthropic", "api.anthropic.com",
        "ollama", "localhost"
    );

    static final Map<String, Integer> PROVIDER_PORTS = Map.of(
        "openai", 443,
        "anthropic", 443,
        "ollama", 11434
    );

    private LlmConfig() {
    }

    static ChatModel resolveChatModel(String provider, Map<String, ChatModel> chatModels) {
        // Spring AI registers one bean per starter: "openAiChatModel", "anthropicChatModel", ...
        return switch (provider) {
            case "openai" -> findBean(chatModels, "openAiChatModel");
            case "anthropic" -> findBean(chatModels, "anthropicChatModel");
            case "ollama" -> findBean(chatModels, "ollamaChatModel");
            default -> throw new IllegalArgumentException("Unknown LLM provider: " + provider);
        };
    }

    private static ChatModel findBean(Map<String, ChatModel> chatModels, String name) {
        var model = chatModels.get(name);
        if (model == null) {
            throw new IllegalStateException(
                "ChatModel bean '" + name + "' not found. Available: " + chatModels.keySet());
        }
        return model;
    }
}
