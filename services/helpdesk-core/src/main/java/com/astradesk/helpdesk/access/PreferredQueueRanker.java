package com.astradesk.helpdesk.access;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.astradesk.helpdesk.domain.PermissionKey;

/**
 * Picks one preferred queue per customer identifier from its grants.
 *
 * <p>Stronger permission keys win ({@code rw} before {@code create}/{@code move_into},
 * before {@code note}/{@code owner}/{@code priority}, before {@code ro}, before
 * unknown keys); equal ranks go to the lowest queue id. The result does not
 * depend on the order of the input.</p>
 */
public final class PreferredQueueRanker {

    private static final Comparator<QueueGrant> PREFERENCE = Comparator
        .comparingInt((QueueGrant grant) -> PermissionKey.rankOf(grant.permissionKey()))
        .thenComparingLong(QueueGrant::queueId);

    private PreferredQueueRanker() {
    }

    public static Map<String, PreferredQueue> rank(List<QueueGrant> grants) {
        Map<String, QueueGrant> best = new HashMap<>();
        for (QueueGrant grant : grants) {
            String identifier = grant.identifier() == null ? "" : grant.identifier().trim();
            if (identifier.isEmpty()) {
                continue;
            }
            best.merge(identifier, grant, (current, candidate) ->
                PREFERENCE.compare(candidate, current) < 0 ? candidate : current);
        }
        Map<String, PreferredQueue> result = new HashMap<>(best.size());
        best.forEach((identifier, grant) ->
            result.put(identifier, new PreferredQueue(grant.queueId(), grant.queueName())));
        return result;
    }
}
