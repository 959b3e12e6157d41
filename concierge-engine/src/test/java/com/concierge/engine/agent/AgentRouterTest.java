package com.concierge.engine.agent;

import com.concierge.advisory.ArbitrationService;
import com.concierge.core.agent.Agent;
import com.concierge.core.model.Task;
import com.concierge.engine.support.StubAgent;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AgentRouterTest {

    private static Task task(String title, String text) {
        var input = JsonNodeFactory.instance.objectNode();
        if (text != null) {
            input.put("text", text);
        }
        return Task.create(title, "user-1", input);
    }

    private static AgentCatalog catalogOf(Agent... agents) {
        AgentCatalog catalog = new AgentCatalog();
        for (Agent agent : agents) {
            catalog.register(agent);
        }
        return catalog;
    }

    @Test
    @DisplayName("Highest confidence above the threshold wins without arbitration")
    void resolve_shouldPickHighestConfidence() {
        AtomicInteger arbitrationCalls = new AtomicInteger();
        ArbitrationService arbitration = (t, c) -> {
            arbitrationCalls.incrementAndGet();
            return Optional.empty();
        };
        Agent low = StubAgent.withConfidence("low", 0.6);
        Agent high = StubAgent.withConfidence("high", 0.9);
        AgentRouter router = new AgentRouter(catalogOf(low, high), arbitration);

        assertThat(router.resolve(task("anything", null))).containsSame(high);
        assertThat(arbitrationCalls).hasValue(0);
    }

    @Test
    @DisplayName("A registered agent named by the task wins even with zero confidence")
    void resolve_withExplicitSlug_shouldBypassScoring() {
        AtomicInteger arbitrationCalls = new AtomicInteger();
        ArbitrationService arbitration = (t, c) -> {
            arbitrationCalls.incrementAndGet();
            return Optional.of("confident");
        };
        Agent mock = StubAgent.withConfidence("mock", 0.0);
        Agent confident = StubAgent.withConfidence("confident", 1.0);
        AgentRouter router = new AgentRouter(catalogOf(mock, confident), arbitration);
        Task task = task("anything", null).toBuilder().agentSlug("mock").build();

        assertThat(router.resolve(task)).containsSame(mock);
        assertThat(arbitrationCalls).hasValue(0);
    }

    @Test
    void resolve_withUnregisteredExplicitSlug_shouldFallBackToScoring() {
        Agent gmail = StubAgent.withConfidence("gmail", 0.9);
        AgentRouter router = new AgentRouter(catalogOf(gmail), ArbitrationService.none());
        Task task = task("anything", null).toBuilder().agentSlug("uninstalled").build();

        assertThat(router.resolve(task)).containsSame(gmail);
    }

    @Test
    void resolve_shouldMatchCapabilityKeywordsInTaskText() {
        Agent gmail = new StubAgent("gmail", "email");
        Agent spotify = new StubAgent("spotify", "music");
        AgentRouter router = new AgentRouter(catalogOf(gmail, spotify), ArbitrationService.none());

        Optional<Agent> agent = router.resolve(task("Chat", "check my email please"));

        assertThat(agent).containsSame(gmail);
    }

    @Test
    @DisplayName("Below the threshold the arbitration answer is used")
    void resolve_belowThreshold_shouldAskArbitration() {
        Agent weather = StubAgent.withConfidence("weather", 0.3);
        Agent calendar = StubAgent.withConfidence("calendar", 0.1);
        ArbitrationService arbitration = (t, candidates) -> {
            assertThat(candidates).extracting(ArbitrationService.AgentCandidate::slug)
                .containsExactly("weather", "calendar");
            return Optional.of("calendar");
        };
        AgentRouter router = new AgentRouter(catalogOf(weather, calendar), arbitration);

        assertThat(router.resolve(task("What's on tomorrow", null))).containsSame(calendar);
    }

    @Test
    void resolve_withUnknownArbitrationSlug_shouldReturnEmpty() {
        AgentRouter router = new AgentRouter(
            catalogOf(StubAgent.withConfidence("weather", 0.2)),
            (t, c) -> Optional.of("hallucinated"));

        assertThat(router.resolve(task("?", null))).isEmpty();
    }

    @Test
    void resolve_withFailingArbitration_shouldReturnEmpty() {
        AgentRouter router = new AgentRouter(
            catalogOf(StubAgent.withConfidence("weather", 0.2)),
            (t, c) -> {
                throw new IllegalStateException("model offline");
            });

        assertThat(router.resolve(task("?", null))).isEmpty();
    }

    @Test
    void resolve_withEmptyCatalog_shouldReturnEmpty() {
        AgentRouter router = new AgentRouter(new AgentCatalog(), (t, c) -> Optional.of("anything"));

        assertThat(router.resolve(task("hello", null))).isEmpty();
    }

    @Test
    void score_shouldRankAndClampConfidences() {
        Agent broken = new StubAgent("broken", t -> {
            throw new IllegalStateException("bad scorer");
        });
        Agent eager = StubAgent.withConfidence("eager", 7.0);
        Agent middling = StubAgent.withConfidence("middling", 0.4);
        AgentRouter router = new AgentRouter(catalogOf(broken, middling, eager), ArbitrationService.none());

        List<AgentScore> scores = router.score(task("x", null));

        assertThat(scores).extracting(AgentScore::slug).containsExactly("eager", "middling", "broken");
        assertThat(scores).extracting(AgentScore::confidence).containsExactly(1.0, 0.4, 0.0);
    }

    @Test
    void resolve_atExactlyThreshold_shouldAccept() {
        Agent exact = StubAgent.withConfidence("exact", AgentRouter.CONFIDENCE_THRESHOLD);
        AgentRouter router = new AgentRouter(catalogOf(exact), (t, c) -> Optional.empty());

        assertThat(router.resolve(task("x", null))).containsSame(exact);
    }
}
