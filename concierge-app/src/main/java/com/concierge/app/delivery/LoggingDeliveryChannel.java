package com.concierge.app.delivery;

import com.concierge.core.delivery.DeliveryChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Delivery used when no channel adapter is installed: the message is logged instead of sent.
 */
public class LoggingDeliveryChannel implements DeliveryChannel {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeliveryChannel.class);

    @Override
    public void deliver(String userId, String text, String channelHint, Map<String, String> threadContext) {
        log.info("Reply for user {} via {} {}: {}",
            userId, channelHint != null ? channelHint : "default", threadContext, text);
    }
}
