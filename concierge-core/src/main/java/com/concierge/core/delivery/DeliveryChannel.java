package com.concierge.core.delivery;

import java.util.Map;

/**
 * Collaborator that delivers text to a user over a messaging channel.
 * Channel wire protocols live behind this interface.
 */
@FunctionalInterface
public interface DeliveryChannel {

    /**
     * Deliver a message.
     *
     * @param userId Recipient
     * @param text Message text
     * @param channelHint Preferred channel type (e.g. "slack"), or null for the user's default
     * @param threadContext Channel-specific reply context (e.g. thread_ts), possibly empty
     * @throws Exception if delivery fails
     */
    void deliver(String userId, String text, String channelHint, Map<String, String> threadContext) throws Exception;
}
