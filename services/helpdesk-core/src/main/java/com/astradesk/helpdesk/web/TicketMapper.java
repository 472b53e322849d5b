package com.astradesk.helpdesk.web;

import java.util.Locale;

import org.springframework.stereotype.Component;

import com.astradesk.helpdesk.domain.HistoryEntry;
import com.astradesk.helpdesk.domain.Queue;
import com.astradesk.helpdesk.domain.Ticket;
import com.astradesk.helpdesk.domain.TicketState;
import com.astradesk.helpdesk.ticket.NoteResult;
import com.astradesk.helpdesk.ticket.TicketDetail;
import com.astradesk.helpdesk.ticket.TicketPage;
import com.astradesk.helpdesk.web.dto.HistoryEntryResponse;
import com.astradesk.helpdesk.web.dto.NoteResponse;
import com.astradesk.helpdesk.web.dto.QueueResponse;
import com.astradesk.helpdesk.web.dto.TicketDetailResponse;
import com.astradesk.helpdesk.web.dto.TicketListResponse;
import com.astradesk.helpdesk.web.dto.TicketResponse;
import com.astradesk.helpdesk.web.dto.TicketStateResponse;

/**
 * Centralises conversion between domain objects and API DTOs so the shape of
 * responses stays consistent across controllers.
 */
@Component
public class TicketMapper {

    public TicketResponse toResponse(Ticket ticket) {
        return new TicketResponse(
            ticket.getId(),
            ticket.getTn(),
            ticket.getTitle(),
            ticket.getQueueId(),
            ticket.getStateId(),
            ticket.getPriorityId(),
            ticket.getOwnerId(),
            ticket.getResponsibleId(),
            ticket.getUntilTime(),
            ticket.getCreatedAt(),
            ticket.getChangedAt(),
            ticket.getChangedBy()
        );
    }

    public TicketDetailResponse toDetailResponse(TicketDetail detail) {
        TicketState state = detail.state();
        return new TicketDetailResponse(
            toResponse(detail.ticket()),
            state == null ? null : state.name(),
            state == null ? null : state.type().name().toLowerCase(Locale.ROOT),
            detail.priority() == null ? null : detail.priority().name(),
            detail.queue() == null ? null : detail.queue().name(),
            detail.autoClose(),
            detail.reminder()
        );
    }

    public TicketListResponse toListResponse(TicketPage page) {
        return new TicketListResponse(page.items(), page.total(), page.limit(), page.offset());
    }

    public NoteResponse toNoteResponse(NoteResult result) {
        return new NoteResponse(result.articleId(), toResponse(result.ticket()));
    }

    public HistoryEntryResponse toHistoryResponse(HistoryEntry entry) {
        return new HistoryEntryResponse(
            entry.id(),
            entry.typeName(),
            entry.message(),
            entry.queueId(),
            entry.ownerId(),
            entry.priorityId(),
            entry.stateId(),
            entry.articleId(),
            entry.createdBy(),
            entry.createdAt()
        );
    }

    public TicketStateResponse toStateResponse(TicketState state) {
        return new TicketStateResponse(
            state.id(),
            state.name(),
            state.slug(),
            state.typeId(),
            state.type().name().toLowerCase(Locale.ROOT),
            state.isPending()
        );
    }

    public QueueResponse toQueueResponse(Queue queue) {
        return new QueueResponse(queue.id(), queue.name());
    }
}
