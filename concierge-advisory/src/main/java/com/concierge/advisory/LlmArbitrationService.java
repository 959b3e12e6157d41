package com.concierge.advisory;

import com.concierge.core.model.Task;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Arbitration over an OpenAI-compatible chat completions endpoint.
 *
 * Usage:
 * <pre>
 * ArbitrationService arbitration = new LlmArbitrationService(
 *     new ArbitrationSettings("https://api.openai.com/v1", apiKey, "gpt-4o-mini", Duration.ofSeconds(30)),
 *     new ObjectMapper());
 * Optional&lt;String&gt; slug = arbitration.route(task, candidates);
 * </pre>
 *
 * Any transport or parsing failure yields an empty answer; the caller treats that
 * as "no capable handler".
 */
public class LlmArbitrationService implements ArbitrationService {

    private static final Logger log = LoggerFactory.getLogger(LlmArbitrationService.class);

    static final String SYSTEM_PROMPT = "You are a task router. Reply with only an agent slug or 'none'.";
    static final String NO_AGENT = "none";

    private final ArbitrationSettings settings;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public LlmArbitrationService(ArbitrationSettings settings, ObjectMapper objectMapper) {
        this(settings, objectMapper, HttpClient.newBuilder()
            .connectTimeout(settings.timeout())
            .build());
    }

    public LlmArbitrationService(ArbitrationSettings settings, ObjectMapper objectMapper, HttpClient httpClient) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public Optional<String> route(Task task, List<AgentCandidate> candidates) {
        if (!settings.isConfigured() || candidates.isEmpty()) {
            return Optional.empty();
        }

        try {
            String body = objectMapper.writeValueAsString(buildRequest(task, candidates));

            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(settings.baseUrl() + "/chat/completions"))
                .timeout(settings.timeout())
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + settings.apiKey())
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                log.warn("Arbitration call failed with status {}", response.statusCode());
                return Optional.empty();
            }

            JsonNode content = objectMapper.readTree(response.body())
                .path("choices").path(0).path("message").path("content");
            return parseSlug(content.asText(""));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Arbitration interrupted for task {}", task.id());
            return Optional.empty();
        } catch (Exception e) {
            log.debug("Arbitration failed for task {}", task.id(), e);
            return Optional.empty();
        }
    }

    ObjectNode buildRequest(Task task, List<AgentCandidate> candidates) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", settings.model());
        root.put("temperature", 0);

        ArrayNode messages = root.putArray("messages");
        messages.addObject()
            .put("role", "system")
            .put("content", SYSTEM_PROMPT);
        messages.addObject()
            .put("role", "user")
            .put("content", buildPrompt(task, candidates));
        return root;
    }

    static String buildPrompt(Task task, List<AgentCandidate> candidates) {
        String agentDescriptions = candidates.stream()
            .map(c -> String.format("- %s: %s (capabilities: %s)",
                c.slug(), c.description(), String.join(", ", c.capabilities())))
            .collect(Collectors.joining("\n"));

        String userText = task.inputText("text");
        return "Given this task: " + task.title() + "\n"
            + "User text: " + (userText != null ? userText : "") + "\n\n"
            + "Available agents:\n" + agentDescriptions + "\n\n"
            + "Which agent slug should handle this? Reply with just the slug, "
            + "or '" + NO_AGENT + "' if no agent fits.";
    }

    /**
     * Normalize a model reply into a slug. Quotes, backticks and a trailing period are stripped.
     */
    static Optional<String> parseSlug(String reply) {
        if (reply == null) {
            return Optional.empty();
        }
        String slug = reply.strip()
            .replace("`", "")
            .replace("\"", "")
            .replace("'", "")
            .toLowerCase(Locale.ROOT);
        if (slug.endsWith(".")) {
            slug = slug.substring(0, slug.length() - 1);
        }
        if (slug.isBlank() || slug.equals(NO_AGENT) || slug.contains(" ")) {
            return Optional.empty();
        }
        return Optional.of(slug);
    }
}
