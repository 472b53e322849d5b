package com.astradesk.helpdesk.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Permission keys stored in {@code group_user.permission_key}.
 *
 * <p>{@link #RW} implies every other key. The string form only exists at the
 * persistence boundary ({@link #key()} / {@link #fromKey(String)}).</p>
 */
public enum PermissionKey {
    RO("ro", 3),
    MOVE_INTO("move_into", 1),
    CREATE("create", 1),
    NOTE("note", 2),
    OWNER("owner", 2),
    PRIORITY("priority", 2),
    RW("rw", 0);

    /** Rank assigned to keys that are not part of this enumeration. */
    public static final int UNKNOWN_RANK = 4;

    private final String key;
    private final int rank;

    PermissionKey(String key, int rank) {
        this.key = key;
        this.rank = rank;
    }

    public String key() {
        return key;
    }

    /**
     * Preference rank when suggesting a queue; lower is stronger.
     */
    public int rank() {
        return rank;
    }

    public static Optional<PermissionKey> fromKey(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (PermissionKey permission : values()) {
            if (permission.key.equals(normalized)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }

    public static int rankOf(String raw) {
        return fromKey(raw).map(PermissionKey::rank).orElse(UNKNOWN_RANK);
    }
}
