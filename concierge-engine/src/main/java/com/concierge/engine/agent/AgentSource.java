package com.concierge.engine.agent;

import com.concierge.core.agent.Agent;

import java.util.Collection;

/**
 * Supplier of agents discovered at startup, e.g. built-in system agents or a plugin directory.
 */
@FunctionalInterface
public interface AgentSource {

    /**
     * Agents contributed by this source.
     *
     * @throws RuntimeException if discovery fails; the catalog skips the source
     */
    Collection<? extends Agent> agents();
}
