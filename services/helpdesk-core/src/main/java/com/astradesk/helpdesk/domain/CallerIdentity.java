package com.astradesk.helpdesk.domain;

import java.util.Objects;

/**
 * The authenticated caller, produced once at the HTTP boundary and passed
 * explicitly to the access resolver and the transition engine.
 *
 * @param userId            agent id, always positive
 * @param login             display login, informational only
 * @param precomputedAccess access decision supplied by upstream middleware, or {@code null}
 */
public record CallerIdentity(long userId, String login, PrecomputedAccess precomputedAccess) {

    public CallerIdentity {
        if (userId <= 0) {
            throw new IllegalArgumentException("userId must be positive");
        }
        login = Objects.requireNonNullElse(login, "");
    }

    public static CallerIdentity of(long userId) {
        return new CallerIdentity(userId, "", null);
    }

    public static CallerIdentity of(long userId, String login) {
        return new CallerIdentity(userId, login, null);
    }

    public boolean hasPrecomputedAccess() {
        return precomputedAccess != null;
    }
}
