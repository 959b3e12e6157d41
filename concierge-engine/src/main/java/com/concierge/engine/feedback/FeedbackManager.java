package com.concierge.engine.feedback;

import com.concierge.core.delivery.DeliveryChannel;
import com.concierge.core.model.Task;
import com.concierge.engine.metrics.ConciergeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Sends task outcomes back to the user over the channel the task came from.
 *
 * Delivery is best effort: a failing channel is logged and reported as false,
 * never thrown, and never changes the task's state.
 */
public class FeedbackManager {

    private static final Logger log = LoggerFactory.getLogger(FeedbackManager.class);

    static final String SUCCESS_MARK = "✅";
    static final String FAILURE_MARK = "❌";

    /**
     * Source channel of scheduled tasks. Their feedback goes to the user's default channel.
     */
    public static final String CRON_CHANNEL = "cron";

    private final DeliveryChannel channel;
    private final ConciergeMetrics metrics;

    public FeedbackManager(DeliveryChannel channel, ConciergeMetrics metrics) {
        this.channel = channel;
        this.metrics = metrics;
    }

    /**
     * Report a successful task.
     *
     * @return true if the message was delivered
     */
    public boolean sendSuccess(Task task, String message) {
        return deliver(task, SUCCESS_MARK + " " + message);
    }

    /**
     * Report a failed task. The error, if any, is appended as a code block.
     *
     * @return true if the message was delivered
     */
    public boolean sendFailure(Task task, String message, String error) {
        String text = FAILURE_MARK + " " + message;
        if (error != null && !error.isBlank()) {
            text += "\n```" + error + "```";
        }
        return deliver(task, text);
    }

    /**
     * Send a plain message about a task.
     *
     * @return true if the message was delivered
     */
    public boolean sendMessage(Task task, String message) {
        return deliver(task, message);
    }

    private boolean deliver(Task task, String text) {
        if (task.sourceChannel() == null) {
            log.debug("Task {} has no source channel, skipping feedback", task.id());
            return false;
        }

        String channelHint = CRON_CHANNEL.equals(task.sourceChannel()) ? null : task.sourceChannel();
        Map<String, String> threadContext = ThreadContexts.of(task);

        try {
            channel.deliver(task.userId(), text, channelHint, threadContext);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Feedback delivery interrupted for task {}", task.id());
            return false;
        } catch (Exception e) {
            log.warn("Failed to deliver feedback for task {} over {}", task.id(), task.sourceChannel(), e);
            metrics.deliveryFailed(task.sourceChannel());
            return false;
        }
    }
}
