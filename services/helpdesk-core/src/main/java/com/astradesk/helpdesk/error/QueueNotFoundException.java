package com.astradesk.helpdesk.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class QueueNotFoundException extends HelpdeskException {

    public QueueNotFoundException() {
        super(HttpStatus.NOT_FOUND, "Queue not found");
    }
}
