package com.astradesk.helpdesk.access;

import java.util.ArrayList;

import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;

/**
 * Turns a {@link QueueScope} into a SQL predicate on a queue id column.
 *
 * <p>Unrestricted scopes add no constraint, empty scopes match nothing, anything
 * else becomes {@code column IN (:queueIds)}.</p>
 */
public final class QueueFilter {

    public static final String PARAMETER = "queueIds";

    private QueueFilter() {
    }

    public static String clause(QueueScope scope, String column) {
        if (scope.isUnrestricted()) {
            return "1 = 1";
        }
        if (scope.isEmpty()) {
            return "1 = 0";
        }
        return column + " IN (:" + PARAMETER + ")";
    }

    public static GenericExecuteSpec bind(GenericExecuteSpec spec, QueueScope scope) {
        if (scope.isUnrestricted() || scope.isEmpty()) {
            return spec;
        }
        return spec.bind(PARAMETER, new ArrayList<>(scope.queueIds()));
    }
}
