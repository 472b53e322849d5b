package com.astradesk.helpdesk.ticket;

import com.astradesk.helpdesk.domain.Queue;
import com.astradesk.helpdesk.domain.Ticket;
import com.astradesk.helpdesk.domain.TicketPriority;
import com.astradesk.helpdesk.domain.TicketState;
import com.astradesk.helpdesk.pending.AutoCloseMeta;
import com.astradesk.helpdesk.pending.ReminderMeta;

/**
 * A ticket with its reference data resolved and the pending-deadline hints
 * evaluated at read time. {@code state}, {@code priority} and {@code queue} are
 * {@code null} when the referenced row no longer exists.
 */
public record TicketDetail(
    Ticket ticket,
    TicketState state,
    TicketPriority priority,
    Queue queue,
    AutoCloseMeta autoClose,
    ReminderMeta reminder
) {
}
