package com.concierge.engine.feedback;

import com.concierge.core.model.Task;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts the channel-specific reply context from a task's input, so that
 * feedback lands in the conversation the request came from.
 *
 * Fields by channel:
 * - slack: thread_ts (falling back to ts), channel
 * - discord: message_id, channel_id
 * - email: message_id, subject
 * - web and anything else: conversation_id
 */
public final class ThreadContexts {

    private ThreadContexts() {
    }

    public static Map<String, String> of(Task task) {
        Map<String, String> context = new LinkedHashMap<>();
        String channel = task.sourceChannel();
        if (channel == null) {
            return context;
        }

        switch (channel) {
            case "slack" -> {
                String threadTs = task.inputText("thread_ts");
                putIfPresent(context, "thread_ts", threadTs != null ? threadTs : task.inputText("ts"));
                putIfPresent(context, "channel", task.inputText("channel"));
            }
            case "discord" -> {
                putIfPresent(context, "message_id", task.inputText("message_id"));
                putIfPresent(context, "channel_id", task.inputText("channel_id"));
            }
            case "email" -> {
                putIfPresent(context, "message_id", task.inputText("message_id"));
                putIfPresent(context, "subject", task.inputText("subject"));
            }
            default -> putIfPresent(context, "conversation_id", task.inputText("conversation_id"));
        }
        return context;
    }

    private static void putIfPresent(Map<String, String> context, String key, String value) {
        if (value != null && !value.isBlank()) {
            context.put(key, value);
        }
    }
}
