package com.concierge.core.queue;

/**
 * A descriptor handed to one worker.
 *
 * @param handle opaque queue handle, used for acknowledgement
 * @param descriptor the task descriptor
 * @param deliveryCount how many times this entry has been handed out, including this one
 */
public record QueueDelivery(String handle, TaskDescriptor descriptor, int deliveryCount) {

    public boolean isRedelivery() {
        return deliveryCount > 1;
    }
}
