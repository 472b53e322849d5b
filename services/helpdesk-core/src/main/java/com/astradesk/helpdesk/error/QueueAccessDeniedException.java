package com.astradesk.helpdesk.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The caller lacks the capability on the queue. The message is deliberately
 * generic and never names the queue.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class QueueAccessDeniedException extends HelpdeskException {

    public static final String REASON = "You do not have permission to access this queue";

    public QueueAccessDeniedException() {
        super(HttpStatus.FORBIDDEN, REASON);
    }
}
