package com.astradesk.helpdesk.access;

/**
 * A raw grant row joined with its queue: who (customer id or login) holds which
 * permission key on which queue.
 */
public record QueueGrant(String identifier, long queueId, String queueName, String permissionKey) {
}
