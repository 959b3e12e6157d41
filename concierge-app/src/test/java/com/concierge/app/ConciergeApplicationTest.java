package com.concierge.app;

import com.concierge.app.lifecycle.ConciergeLifecycle;
import com.concierge.core.agent.Agent;
import com.concierge.core.agent.AgentResult;
import com.concierge.core.model.EventKind;
import com.concierge.core.model.RetryPolicy;
import com.concierge.core.model.Task;
import com.concierge.core.model.TaskStatus;
import com.concierge.core.repository.TaskRepository;
import com.concierge.engine.agent.AgentCatalog;
import com.concierge.engine.subscription.SubscriptionManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Boots the whole application in memory mode and drives it over HTTP.
 */
@SpringBootTest(properties = {
    "concierge.persistence=memory",
    "concierge.worker.threads=2",
    "concierge.worker.poll-interval=50ms"
})
@AutoConfigureMockMvc
class ConciergeApplicationTest {

    private static final String USER_HEADER = "X-User-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ConciergeLifecycle lifecycle;

    @Autowired
    private AgentCatalog catalog;

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private SubscriptionManager subscriptions;

    @Autowired
    private RetryPolicy retryPolicy;

    @TestConfiguration
    static class EchoAgentConfiguration {

        @Bean
        Agent echoAgent() {
            return new Agent() {
                @Override
                public String slug() {
                    return "echo";
                }

                @Override
                public List<String> capabilities() {
                    return List.of("echo");
                }

                @Override
                public AgentResult execute(Task task) {
                    return AgentResult.summary("echoed: " + task.inputText("text"));
                }
            };
        }
    }

    @Test
    void context_shouldStartWithBuiltInAgents() {
        assertThat(lifecycle.isStarted()).isTrue();
        assertThat(catalog.slugs()).contains("cron", "task-manager", "echo");
    }

    @Test
    void retryPolicy_shouldUseFixedCapAndBackoff() {
        assertThat(retryPolicy.maxRetries()).isEqualTo(RetryPolicy.MAX_RETRIES);
        assertThat(retryPolicy).isEqualTo(RetryPolicy.defaultPolicy());
    }

    @Test
    @DisplayName("A published user message becomes a task that a worker runs to success")
    void publishedMessage_shouldRunToSuccess() throws Exception {
        CountDownLatch completed = new CountDownLatch(1);
        subscriptions.subscribe(EventKind.TASK_COMPLETE, event -> completed.countDown());

        mockMvc.perform(post("/api/v1/events")
                .header(USER_HEADER, "user-smoke")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"kind": "user_message", "payload": {"text": "echo hello"}, "sourceChannel": "web"}
                    """))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.handlerFaults").value(0));

        assertThat(completed.await(10, TimeUnit.SECONDS)).isTrue();

        Optional<Task> task = taskRepository.findByUser("user-smoke", 10).stream().findFirst();
        assertThat(task).isPresent();
        assertThat(task.get().status()).isEqualTo(TaskStatus.SUCCESS);
        assertThat(task.get().agentSlug()).isEqualTo("echo");

        mockMvc.perform(get("/api/v1/tasks/" + task.get().id()).header(USER_HEADER, "user-smoke"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"));

        mockMvc.perform(get("/api/v1/tasks/" + task.get().id()).header(USER_HEADER, "someone-else"))
            .andExpect(status().isNotFound());
    }

    @Test
    void lifecycleEvents_shouldNotBePublishableExternally() throws Exception {
        mockMvc.perform(post("/api/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"kind": "task_complete", "payload": {}}
                    """))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Schedule API validates, detects duplicate names and renders timing")
    void scheduleApi_shouldValidateAndDetectDuplicates() throws Exception {
        mockMvc.perform(post("/api/v1/schedules")
                .header(USER_HEADER, "user-cron")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"name": "broken", "cronExpression": "0 25 * * *"}
                    """))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorCode").value("INVALID_CRON_EXPRESSION"));

        String body = """
            {"name": "standup", "cronExpression": "0 9 * * 1-5", "agentSlug": "echo", "taskPayload": {"text": "echo standup"}}
            """;
        mockMvc.perform(post("/api/v1/schedules")
                .header(USER_HEADER, "user-cron")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.cronHuman").value("Weekdays at 9:00 UTC"))
            .andExpect(jsonPath("$.nextRunAt").exists());

        mockMvc.perform(post("/api/v1/schedules")
                .header(USER_HEADER, "user-cron")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("DUPLICATE_SCHEDULE"));

        mockMvc.perform(get("/api/v1/schedules").header(USER_HEADER, "user-cron"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(delete("/api/v1/schedules/does-not-exist").header(USER_HEADER, "user-cron"))
            .andExpect(status().isNotFound());
    }

    @Test
    void health_shouldReportComponents() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.components.concierge.status").value("UP"))
            .andExpect(jsonPath("$.components.concierge.details['cron.running']").value(true));
    }
}
