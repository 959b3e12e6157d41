package com.concierge.engine.agent;

import com.concierge.advisory.ArbitrationService;
import com.concierge.advisory.ArbitrationService.AgentCandidate;
import com.concierge.core.agent.Agent;
import com.concierge.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the agent that should run a task.
 *
 * Resolution order:
 * 1. The agent the task names, if it is registered (no scoring)
 * 2. Highest self-reported confidence, if it reaches {@link #CONFIDENCE_THRESHOLD}
 * 3. The arbitration service, given every agent's description and capabilities
 * 4. No agent
 *
 * Arbitration only ever names an agent; a slug it returns that is not in the
 * catalog counts as no answer.
 */
public class AgentRouter {

    private static final Logger log = LoggerFactory.getLogger(AgentRouter.class);

    /**
     * Minimum confidence for an agent to win without arbitration.
     */
    public static final double CONFIDENCE_THRESHOLD = 0.5;

    private final AgentCatalog catalog;
    private final ArbitrationService arbitration;

    public AgentRouter(AgentCatalog catalog, ArbitrationService arbitration) {
        this.catalog = catalog;
        this.arbitration = arbitration;
    }

    /**
     * Resolve the agent for a task.
     *
     * @param task The task to route
     * @return The chosen agent, or empty if none fits
     */
    public Optional<Agent> resolve(Task task) {
        if (task.hasExplicitAgent()) {
            Optional<Agent> pinned = catalog.get(task.agentSlug());
            if (pinned.isPresent()) {
                return pinned;
            }
            log.warn("Agent '{}' named by task {} is not registered, routing instead", task.agentSlug(), task.id());
        }

        List<AgentScore> scores = score(task);
        if (scores.isEmpty()) {
            log.debug("No agents registered, cannot route task {}", task.id());
            return Optional.empty();
        }

        AgentScore best = scores.get(0);
        if (best.confidence() >= CONFIDENCE_THRESHOLD) {
            log.debug("Task {} routed to {} with confidence {}", task.id(), best.slug(), best.confidence());
            return Optional.of(best.agent());
        }

        return arbitrate(task);
    }

    /**
     * Confidence of every agent for the task, highest first. Ties keep catalog order.
     */
    public List<AgentScore> score(Task task) {
        List<AgentScore> scores = new ArrayList<>();
        for (Agent agent : catalog.list()) {
            scores.add(new AgentScore(agent, confidenceOf(agent, task)));
        }
        scores.sort(Comparator.comparingDouble(AgentScore::confidence).reversed());
        return scores;
    }

    private Optional<Agent> arbitrate(Task task) {
        List<AgentCandidate> candidates = catalog.list().stream()
            .map(a -> new AgentCandidate(a.slug(), a.description(), a.capabilities()))
            .toList();

        Optional<String> slug;
        try {
            slug = arbitration.route(task, candidates);
        } catch (RuntimeException e) {
            log.warn("Arbitration failed for task {}", task.id(), e);
            return Optional.empty();
        }

        if (slug.isEmpty()) {
            log.debug("Arbitration found no agent for task {}", task.id());
            return Optional.empty();
        }

        Optional<Agent> agent = catalog.get(slug.get());
        if (agent.isEmpty()) {
            log.warn("Arbitration named unknown agent '{}' for task {}", slug.get(), task.id());
        } else {
            log.debug("Task {} routed to {} by arbitration", task.id(), slug.get());
        }
        return agent;
    }

    private double confidenceOf(Agent agent, Task task) {
        try {
            double confidence = agent.confidence(task);
            if (Double.isNaN(confidence)) {
                return 0.0;
            }
            return Math.max(0.0, Math.min(1.0, confidence));
        } catch (RuntimeException e) {
            log.warn("Agent {} failed to score task {}", agent.slug(), task.id(), e);
            return 0.0;
        }
    }
}
