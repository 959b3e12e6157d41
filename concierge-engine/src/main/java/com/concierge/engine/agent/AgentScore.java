package com.concierge.engine.agent;

import com.concierge.core.agent.Agent;

/**
 * Confidence of one agent for one task.
 */
public record AgentScore(Agent agent, double confidence) {

    public String slug() {
        return agent.slug();
    }
}
