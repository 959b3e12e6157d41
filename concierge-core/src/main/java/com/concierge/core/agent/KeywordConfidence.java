package com.concierge.core.agent;

import com.concierge.core.model.Task;

import java.util.List;
import java.util.Locale;

/**
 * Default keyword heuristic for agent confidence.
 *
 * <pre>
 * confidence = min(matches / capabilityCount, 1.0) * KEYWORD_WEIGHT
 * </pre>
 *
 * where matches counts declared capabilities appearing (case-insensitive substring)
 * in the task title and free-text input fields.
 */
public final class KeywordConfidence {

    /**
     * Ceiling for keyword-only confidence; an explicit slug is the only way to reach 1.0.
     */
    public static final double KEYWORD_WEIGHT = 0.8;

    private KeywordConfidence() {
    }

    public static double score(List<String> capabilities, Task task) {
        if (capabilities == null || capabilities.isEmpty()) {
            return 0.0;
        }
        return score(capabilities, task.searchableText());
    }

    public static double score(List<String> capabilities, String text) {
        if (capabilities == null || capabilities.isEmpty() || text == null) {
            return 0.0;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        long matches = capabilities.stream()
            .filter(cap -> cap != null && !cap.isBlank())
            .filter(cap -> haystack.contains(cap.toLowerCase(Locale.ROOT)))
            .count();
        return Math.min((double) matches / capabilities.size(), 1.0) * KEYWORD_WEIGHT;
    }
}
