package com.astradesk.helpdesk.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Settings for access control, pending-time handling and history reads.
 *
 * <p>The structure mirrors the {@code helpdesk} section of {@code application.yml}.
 * Validation catches broken settings at startup instead of at the first request.</p>
 */
@Validated
@ConfigurationProperties(prefix = "helpdesk")
public class HelpdeskProperties {

    @Valid
    @NestedConfigurationProperty
    private final AccessProperties access = new AccessProperties();

    @Valid
    @NestedConfigurationProperty
    private final PendingProperties pending = new PendingProperties();

    @Valid
    @NestedConfigurationProperty
    private final HistoryProperties history = new HistoryProperties();

    public AccessProperties getAccess() {
        return access;
    }

    public PendingProperties getPending() {
        return pending;
    }

    public HistoryProperties getHistory() {
        return history;
    }

    public static class AccessProperties {

        /**
         * Agents that bypass queue permissions entirely.
         */
        @NotNull
        private Set<Long> adminUserIds = new LinkedHashSet<>(Set.of(1L));

        /**
         * Members of this group (case-insensitive name) bypass queue permissions.
         */
        @NotBlank
        private String adminGroup = "admin";

        public Set<Long> getAdminUserIds() {
            return adminUserIds;
        }

        public void setAdminUserIds(Set<Long> adminUserIds) {
            this.adminUserIds = adminUserIds;
        }

        public String getAdminGroup() {
            return adminGroup;
        }

        public void setAdminGroup(String adminGroup) {
            this.adminGroup = adminGroup;
        }
    }

    public static class PendingProperties {

        /**
         * Offset used when a pending ticket has no stored deadline.
         */
        @NotNull
        private Duration defaultOffset = Duration.ofHours(24);

        /**
         * Zone for pending times given without an offset and for history messages.
         */
        @NotBlank
        private String zone = "UTC";

        public Duration getDefaultOffset() {
            return defaultOffset;
        }

        public void setDefaultOffset(Duration defaultOffset) {
            this.defaultOffset = defaultOffset;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    public static class HistoryProperties {

        @Min(1)
        private int defaultLimit = 50;

        @Min(1)
        @Max(1000)
        private int maxLimit = 500;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        /**
         * Clamps a requested page size into {@code [1, maxLimit]}; non-positive
         * values fall back to the default.
         */
        public int clamp(Integer requested) {
            if (requested == null || requested <= 0) {
                return defaultLimit;
            }
            return Math.min(requested, maxLimit);
        }
    }
}
