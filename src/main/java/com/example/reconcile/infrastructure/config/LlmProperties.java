package com.example.reconcile.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings of the LLM disambiguation stage. The stage is only available when an API key is set.
 *
 * @param provider          API flavour
 * @param apiKey            secret key, blank disables the stage
 * @param baseUrl           endpoint root, defaults per provider
 * @param model             model name, defaults per provider
 * @param maxTextLength     characters of document text sent in the prompt
 * @param maxTokens         completion token limit
 * @param defaultConfidence confidence assumed when the model omits one
 * @param connectTimeout    TCP connect timeout
 * @param readTimeout       response timeout
 */
@ConfigurationProperties(prefix = "reconcile.llm")
public record LlmProperties(
        LlmProvider provider,
        String apiKey,
        String baseUrl,
        String model,
        int maxTextLength,
        int maxTokens,
        double defaultConfidence,
        Duration connectTimeout,
        Duration readTimeout
) {

    public LlmProperties {
        provider = provider == null ? LlmProvider.OPENAI : provider;
        baseUrl = baseUrl == null || baseUrl.isBlank() ? provider.defaultBaseUrl() : stripTrailingSlash(baseUrl);
        model = model == null || model.isBlank() ? provider.defaultModel() : model;
        maxTextLength = maxTextLength <= 0 ? 8000 : maxTextLength;
        maxTokens = maxTokens <= 0 ? 500 : maxTokens;
        defaultConfidence = defaultConfidence <= 0 ? 0.7 : defaultConfidence;
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
        readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    }

    public static LlmProperties withApiKey(LlmProvider provider, String apiKey) {
        return new LlmProperties(provider, apiKey, null, null, 0, 0, 0, null, null);
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String endpoint() {
        return baseUrl + provider.path();
    }

    private static String stripTrailingSlash(String value) {
        String trimmed = value.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
