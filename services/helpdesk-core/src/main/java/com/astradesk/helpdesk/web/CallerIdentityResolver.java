package com.astradesk.helpdesk.web;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import com.astradesk.helpdesk.domain.CallerIdentity;
import com.astradesk.helpdesk.domain.PermissionKey;
import com.astradesk.helpdesk.domain.PrecomputedAccess;
import com.astradesk.helpdesk.error.UnauthenticatedCallerException;

import reactor.core.publisher.Mono;

/**
 * Turns a validated access token into a {@link CallerIdentity}.
 *
 * <p>The agent id comes from the {@code uid} claim, or from a numeric {@code sub}.
 * Upstream gateways may add {@code queue_admin} or {@code queue_ids} (with
 * {@code queue_capability}, default {@code ro}) to skip the permission lookup.</p>
 */
@Component
public class CallerIdentityResolver {

    static final String USER_ID_CLAIM = "uid";
    static final String QUEUE_ADMIN_CLAIM = "queue_admin";
    static final String QUEUE_IDS_CLAIM = "queue_ids";
    static final String QUEUE_CAPABILITY_CLAIM = "queue_capability";
    static final String LOGIN_CLAIM = "preferred_username";

    /**
     * Deferred variant for reactive handlers; resolution errors become error signals.
     */
    public Mono<CallerIdentity> caller(Jwt jwt) {
        return Mono.fromCallable(() -> resolve(jwt));
    }

    public CallerIdentity resolve(Jwt jwt) {
        if (jwt == null) {
            throw new UnauthenticatedCallerException();
        }
        long userId = userId(jwt);
        if (userId <= 0) {
            throw new UnauthenticatedCallerException();
        }
        String login = jwt.getClaimAsString(LOGIN_CLAIM);
        return new CallerIdentity(userId, login != null ? login : jwt.getSubject(), precomputedAccess(jwt));
    }

    private static long userId(Jwt jwt) {
        Object claim = jwt.getClaims().get(USER_ID_CLAIM);
        if (claim instanceof Number number) {
            return number.longValue();
        }
        if (claim != null) {
            return parse(claim.toString());
        }
        return parse(jwt.getSubject());
    }

    private static PrecomputedAccess precomputedAccess(Jwt jwt) {
        if (Boolean.TRUE.equals(jwt.getClaimAsBoolean(QUEUE_ADMIN_CLAIM))) {
            return PrecomputedAccess.adminBypass();
        }
        Object queueIds = jwt.getClaims().get(QUEUE_IDS_CLAIM);
        if (!(queueIds instanceof Collection<?> values)) {
            return null;
        }
        PermissionKey capability = PermissionKey.fromKey(jwt.getClaimAsString(QUEUE_CAPABILITY_CLAIM))
            .orElse(PermissionKey.RO);
        Set<Long> ids = new LinkedHashSet<>();
        for (Object value : values) {
            long id = value instanceof Number number ? number.longValue() : parse(String.valueOf(value));
            if (id > 0) {
                ids.add(id);
            }
        }
        return PrecomputedAccess.forQueues(capability, ids);
    }

    private static long parse(String value) {
        if (value == null || value.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
