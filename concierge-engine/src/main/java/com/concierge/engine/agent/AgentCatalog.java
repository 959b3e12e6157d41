package com.concierge.engine.agent;

import com.concierge.core.agent.Agent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Catalog of available agents keyed by slug.
 *
 * Discovery from the configured sources runs at most once per process; later
 * lookups see the loaded set plus anything registered directly.
 * Registering a slug that already exists replaces the earlier agent in place.
 */
public class AgentCatalog {

    private static final Logger log = LoggerFactory.getLogger(AgentCatalog.class);

    private final List<AgentSource> sources;
    private final Map<String, Agent> agents = new LinkedHashMap<>();
    private volatile boolean loaded;

    public AgentCatalog(List<AgentSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public AgentCatalog() {
        this(List.of());
    }

    /**
     * Run discovery if it has not run yet. A source that fails is logged and skipped.
     */
    public void load() {
        if (loaded) {
            return;
        }
        synchronized (this) {
            if (loaded) {
                return;
            }
            for (AgentSource source : sources) {
                try {
                    source.agents().forEach(this::register);
                } catch (RuntimeException e) {
                    log.warn("Agent source {} failed to load", source.getClass().getSimpleName(), e);
                }
            }
            loaded = true;
            log.info("Agent catalog loaded with {} agents: {}", agents.size(), agents.keySet());
        }
    }

    /**
     * Add or replace an agent.
     */
    public synchronized void register(Agent agent) {
        Objects.requireNonNull(agent, "agent");
        Agent previous = agents.put(agent.slug(), agent);
        if (previous != null && previous != agent) {
            log.warn("Agent {} replaced by {}", agent.slug(), agent.getClass().getSimpleName());
        }
    }

    public Optional<Agent> get(String slug) {
        load();
        synchronized (this) {
            return Optional.ofNullable(agents.get(slug));
        }
    }

    /**
     * All agents in registration order.
     */
    public List<Agent> list() {
        load();
        synchronized (this) {
            return List.copyOf(agents.values());
        }
    }

    public List<String> slugs() {
        load();
        synchronized (this) {
            return new ArrayList<>(agents.keySet());
        }
    }

    public boolean isLoaded() {
        return loaded;
    }
}
