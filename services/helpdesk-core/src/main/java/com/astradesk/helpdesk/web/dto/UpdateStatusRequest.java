package com.astradesk.helpdesk.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.constraints.Size;

/**
 * Payload for {@code PUT /tickets/{id}/status}. {@code status} accepts a state
 * name, its slug or a numeric id; presence is checked by the service so the
 * error reason stays stable.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UpdateStatusRequest {

    @Size(max = 200)
    private String status;

    @Size(max = 64)
    private String pendingUntil;

    public UpdateStatusRequest() {
    }

    public UpdateStatusRequest(String status, String pendingUntil) {
        this.status = status;
        this.pendingUntil = pendingUntil;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getPendingUntil() {
        return pendingUntil;
    }

    public void setPendingUntil(String pendingUntil) {
        this.pendingUntil = pendingUntil;
    }
}
