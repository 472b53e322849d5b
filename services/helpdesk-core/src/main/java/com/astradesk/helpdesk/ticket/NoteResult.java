package com.astradesk.helpdesk.ticket;

import com.astradesk.helpdesk.domain.Ticket;

/**
 * @param articleId id of the stored note
 * @param ticket    the ticket after the note (and any state change) was applied
 */
public record NoteResult(long articleId, Ticket ticket) {
}
