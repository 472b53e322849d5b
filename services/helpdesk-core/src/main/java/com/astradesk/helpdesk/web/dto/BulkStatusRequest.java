package com.astradesk.helpdesk.web.dto;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BulkStatusRequest {

    @Size(max = 500, message = "at most 500 tickets per request")
    private List<Long> ticketIds = new ArrayList<>();

    @Size(max = 200)
    private String status;

    @Size(max = 64)
    private String pendingUntil;

    public BulkStatusRequest() {
    }

    public BulkStatusRequest(List<Long> ticketIds, String status, String pendingUntil) {
        this.ticketIds = ticketIds;
        this.status = status;
        this.pendingUntil = pendingUntil;
    }

    public List<Long> getTicketIds() {
        return ticketIds;
    }

    public void setTicketIds(List<Long> ticketIds) {
        this.ticketIds = ticketIds;
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
