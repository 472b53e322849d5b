package com.astradesk.helpdesk.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.constraints.Size;

/**
 * Internal note, optionally combined with a state change.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AddNoteRequest {

    @Size(max = 65536)
    private String body;

    @Size(max = 200)
    private String nextStatus;

    @Size(max = 64)
    private String pendingUntil;

    public AddNoteRequest() {
    }

    public AddNoteRequest(String body, String nextStatus, String pendingUntil) {
        this.body = body;
        this.nextStatus = nextStatus;
        this.pendingUntil = pendingUntil;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public String getNextStatus() {
        return nextStatus;
    }

    public void setNextStatus(String nextStatus) {
        this.nextStatus = nextStatus;
    }

    public String getPendingUntil() {
        return pendingUntil;
    }

    public void setPendingUntil(String pendingUntil) {
        this.pendingUntil = pendingUntil;
    }
}
