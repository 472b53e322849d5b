package com.astradesk.helpdesk.web.dto;

import java.time.Instant;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Ticket as returned by the write endpoints and embedded in the detail view.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TicketResponse {

    private final Long id;
    private final String tn;
    private final String title;
    private final Long queueId;
    private final Long stateId;
    private final Long priorityId;
    private final Long ownerId;
    private final Long responsibleId;
    private final long untilTime;
    private final Instant createdAt;
    private final Instant changedAt;
    private final Long changedBy;

    public TicketResponse(
        Long id,
        String tn,
        String title,
        Long queueId,
        Long stateId,
        Long priorityId,
        Long ownerId,
        Long responsibleId,
        long untilTime,
        Instant createdAt,
        Instant changedAt,
        Long changedBy
    ) {
        this.id = id;
        this.tn = tn;
        this.title = title;
        this.queueId = queueId;
        this.stateId = stateId;
        this.priorityId = priorityId;
        this.ownerId = ownerId;
        this.responsibleId = responsibleId;
        this.untilTime = untilTime;
        this.createdAt = createdAt;
        this.changedAt = changedAt;
        this.changedBy = changedBy;
    }

    public Long getId() {
        return id;
    }

    public String getTn() {
        return tn;
    }

    public String getTitle() {
        return title;
    }

    public Long getQueueId() {
        return queueId;
    }

    public Long getStateId() {
        return stateId;
    }

    public Long getPriorityId() {
        return priorityId;
    }

    public Long getOwnerId() {
        return ownerId;
    }

    public Long getResponsibleId() {
        return responsibleId;
    }

    public long getUntilTime() {
        return untilTime;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getChangedAt() {
        return changedAt;
    }

    public Long getChangedBy() {
        return changedBy;
    }
}
