package com.concierge.core.agent;

import com.concierge.core.model.Task;

import java.util.List;

/**
 * A registered capability handler wrapping one third-party service.
 *
 * Implementations must be safe to call from several worker threads at once.
 */
public interface Agent {

    /**
     * Globally unique identifier, e.g. {@code "gmail"} or {@code "cron"}.
     */
    String slug();

    /**
     * Human-readable name.
     */
    default String name() {
        return slug();
    }

    /**
     * One-line description, shown to the arbitration step.
     */
    default String description() {
        return "";
    }

    /**
     * Keywords this agent handles. Matched case-insensitively against task text.
     */
    List<String> capabilities();

    /**
     * Estimate how well this agent fits the task, in [0, 1].
     * Defaults to the keyword heuristic; override for smarter matching.
     */
    default double confidence(Task task) {
        return KeywordConfidence.score(capabilities(), task);
    }

    /**
     * Execute the task.
     *
     * @param task the claimed task, with its input data
     * @return the outcome; failures may be reported either here or by throwing
     * @throws AgentException if the work fails
     */
    AgentResult execute(Task task) throws AgentException;
}
