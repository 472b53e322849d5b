package com.astradesk.helpdesk.access;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The set of queues a caller may see for one capability.
 *
 * <p>Admins get {@link #all()}, a sentinel that is never expanded into queue ids.
 * Consumers must branch on {@link #isUnrestricted()}: {@link #queueIds()} refuses
 * to answer for the sentinel.</p>
 */
public final class QueueScope {

    private static final QueueScope ALL = new QueueScope(true, Collections.emptySortedSet());
    private static final QueueScope NONE = new QueueScope(false, Collections.emptySortedSet());

    private final boolean unrestricted;
    private final SortedSet<Long> queueIds;

    private QueueScope(boolean unrestricted, SortedSet<Long> queueIds) {
        this.unrestricted = unrestricted;
        this.queueIds = queueIds;
    }

    public static QueueScope all() {
        return ALL;
    }

    public static QueueScope none() {
        return NONE;
    }

    public static QueueScope of(Collection<Long> queueIds) {
        if (queueIds == null || queueIds.isEmpty()) {
            return NONE;
        }
        SortedSet<Long> ids = new TreeSet<>();
        for (Long id : queueIds) {
            if (id != null && id > 0) {
                ids.add(id);
            }
        }
        return ids.isEmpty() ? NONE : new QueueScope(false, Collections.unmodifiableSortedSet(ids));
    }

    public boolean isUnrestricted() {
        return unrestricted;
    }

    /**
     * True when nothing is visible: restricted and without any queue.
     */
    public boolean isEmpty() {
        return !unrestricted && queueIds.isEmpty();
    }

    public boolean permits(long queueId) {
        return unrestricted || queueIds.contains(queueId);
    }

    /**
     * Ids of the visible queues, ascending.
     *
     * @throws IllegalStateException for the unrestricted sentinel
     */
    public SortedSet<Long> queueIds() {
        if (unrestricted) {
            throw new IllegalStateException("Unrestricted scope has no queue id list");
        }
        return queueIds;
    }

    /**
     * Narrows this scope to a single explicitly requested queue. Callers must
     * check {@link #permits(long)} first; narrowing to a queue outside the scope
     * yields an empty scope.
     */
    public QueueScope narrowTo(long queueId) {
        if (!permits(queueId)) {
            return NONE;
        }
        return new QueueScope(false, Collections.unmodifiableSortedSet(new TreeSet<>(Collections.singleton(queueId))));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof QueueScope scope)) {
            return false;
        }
        return unrestricted == scope.unrestricted && queueIds.equals(scope.queueIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unrestricted, queueIds);
    }

    @Override
    public String toString() {
        return unrestricted ? "QueueScope[all]" : "QueueScope" + queueIds;
    }
}
