package com.concierge.agents;

import com.concierge.core.agent.Agent;
import com.concierge.core.agent.AgentException;
import com.concierge.core.agent.AgentResult;
import com.concierge.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Base for built-in agents driven by an {@code action} field in the task input.
 * A task without one runs the default action; an unknown action fails permanently.
 */
public abstract class ActionAgent implements Agent {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    public static final String ACTION_FIELD = "action";

    /**
     * Actions this agent understands, the first being the default.
     */
    protected abstract List<String> actions();

    protected abstract AgentResult perform(String action, Task task) throws AgentException;

    @Override
    public final AgentResult execute(Task task) throws AgentException {
        String requested = task.inputText(ACTION_FIELD);
        String action = requested == null || requested.isBlank()
            ? actions().get(0)
            : requested.trim().toLowerCase(Locale.ROOT);

        if (!actions().contains(action)) {
            return AgentResult.permanentFailure("Unknown action: " + action);
        }

        log.info("{} executing action: {}", slug(), action);
        return perform(action, task);
    }

    /**
     * First non-blank text among the given input fields.
     */
    protected static String firstText(Task task, String... fields) {
        for (String field : fields) {
            String value = task.inputText(field);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
