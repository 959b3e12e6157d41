package com.concierge.advisory;

import com.concierge.core.model.Task;

import java.util.List;
import java.util.Optional;

/**
 * LLM-backed arbitration consulted when keyword confidence is inconclusive.
 *
 * CRITICAL: This service is READ-ONLY. It names the agent it would pick
 * and nothing else; it must never mutate the task or any stored state.
 */
public interface ArbitrationService {

    /**
     * Ask which agent should handle a task.
     *
     * @param task The task being routed
     * @param candidates Every registered agent, in catalog order
     * @return The chosen slug, or empty if no agent fits or no answer was obtained
     */
    Optional<String> route(Task task, List<AgentCandidate> candidates);

    /**
     * Arbitration that never picks an agent. Used when no LLM is configured.
     */
    static ArbitrationService none() {
        return (task, candidates) -> Optional.empty();
    }

    /**
     * What the arbitration step is told about an agent.
     */
    record AgentCandidate(
        String slug,
        String description,
        List<String> capabilities
    ) {}
}
