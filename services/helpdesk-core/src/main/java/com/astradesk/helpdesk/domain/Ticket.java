package com.astradesk.helpdesk.domain;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Persistent representation of a helpdesk ticket.
 *
 * <p>Tickets are created elsewhere; this service only mutates state, priority,
 * queue, owner, responsible agent and pending time, always through
 * {@code TicketTransitionService}. {@code untilTime} is epoch seconds and
 * {@code 0} means "no pending deadline".</p>
 */
@Table("ticket")
public class Ticket {

    @Id
    private Long id;

    /** Human ticket number, immutable once assigned. */
    private String tn;

    private String title;

    @Column("queue_id")
    private Long queueId;

    @Column("ticket_state_id")
    private Long stateId;

    @Column("ticket_priority_id")
    private Long priorityId;

    @Column("user_id")
    private Long ownerId;

    @Column("responsible_user_id")
    private Long responsibleId;

    @Column("until_time")
    private long untilTime;

    @Column("customer_id")
    private String customerId;

    @Column("customer_user_id")
    private String customerUserId;

    @Column("create_time")
    private Instant createdAt;

    @Column("create_by")
    private Long createdBy;

    @Column("change_time")
    private Instant changedAt;

    @Column("change_by")
    private Long changedBy;

    public Ticket() {
        // default constructor required by Spring Data
    }

    public Ticket(Long id, String tn, String title, Long queueId, Long stateId, Long priorityId) {
        this.id = id;
        this.tn = tn;
        this.title = title;
        this.queueId = queueId;
        this.stateId = stateId;
        this.priorityId = priorityId;
    }

    /**
     * Detached copy, used when the row cannot be re-read after a write.
     */
    public static Ticket copyOf(Ticket source) {
        Ticket copy = new Ticket(
            source.id,
            source.tn,
            source.title,
            source.queueId,
            source.stateId,
            source.priorityId
        );
        copy.ownerId = source.ownerId;
        copy.responsibleId = source.responsibleId;
        copy.untilTime = source.untilTime;
        copy.customerId = source.customerId;
        copy.customerUserId = source.customerUserId;
        copy.createdAt = source.createdAt;
        copy.createdBy = source.createdBy;
        copy.changedAt = source.changedAt;
        copy.changedBy = source.changedBy;
        return copy;
    }

    public boolean hasPendingTime() {
        return untilTime > 0;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTn() {
        return tn;
    }

    public void setTn(String tn) {
        this.tn = tn;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Long getQueueId() {
        return queueId;
    }

    public void setQueueId(Long queueId) {
        this.queueId = queueId;
    }

    public Long getStateId() {
        return stateId;
    }

    public void setStateId(Long stateId) {
        this.stateId = stateId;
    }

    public Long getPriorityId() {
        return priorityId;
    }

    public void setPriorityId(Long priorityId) {
        this.priorityId = priorityId;
    }

    public Long getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(Long ownerId) {
        this.ownerId = ownerId;
    }

    public Long getResponsibleId() {
        return responsibleId;
    }

    public void setResponsibleId(Long responsibleId) {
        this.responsibleId = responsibleId;
    }

    public long getUntilTime() {
        return untilTime;
    }

    public void setUntilTime(long untilTime) {
        this.untilTime = untilTime;
    }

    public String getCustomerId() {
        return customerId;
    }

    public void setCustomerId(String customerId) {
        this.customerId = customerId;
    }

    public String getCustomerUserId() {
        return customerUserId;
    }

    public void setCustomerUserId(String customerUserId) {
        this.customerUserId = customerUserId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }

    public Instant getChangedAt() {
        return changedAt;
    }

    public void setChangedAt(Instant changedAt) {
        this.changedAt = changedAt;
    }

    public Long getChangedBy() {
        return changedBy;
    }

    public void setChangedBy(Long changedBy) {
        this.changedBy = changedBy;
    }
}
