package com.astradesk.helpdesk.domain;

/**
 * A ticket queue. Every queue belongs to exactly one permission group.
 */
public record Queue(long id, String name, long groupId) {
}
