package com.example.reconcile.infrastructure.config;

/**
 * Supported LLM HTTP APIs with their default endpoint and model.
 */
public enum LlmProvider {
    OPENAI("https://api.openai.com", "/v1/chat/completions", "gpt-4o-mini"),
    ANTHROPIC("https://api.anthropic.com", "/v1/messages", "claude-3-haiku-20240307");

    private final String defaultBaseUrl;
    private final String path;
    private final String defaultModel;

    LlmProvider(String defaultBaseUrl, String path, String defaultModel) {
        this.defaultBaseUrl = defaultBaseUrl;
        this.path = path;
        this.defaultModel = defaultModel;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String path() {
        return path;
    }

    public String defaultModel() {
        return defaultModel;
    }
}
