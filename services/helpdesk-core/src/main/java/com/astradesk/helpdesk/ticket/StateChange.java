package com.astradesk.helpdesk.ticket;

import com.astradesk.helpdesk.domain.TicketState;

/**
 * A validated state transition: the target state and the pending deadline to store
 * with it (epoch seconds, {@code 0} for none).
 */
record StateChange(TicketState target, long untilTime) {
}
