package com.concierge.advisory;

import java.time.Duration;

/**
 * Connection settings for an OpenAI-compatible chat completions endpoint.
 */
public record ArbitrationSettings(
    String baseUrl,
    String apiKey,
    String model,
    Duration timeout
) {
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    public ArbitrationSettings {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (model == null || model.isBlank()) {
            model = DEFAULT_MODEL;
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(30);
        }
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
