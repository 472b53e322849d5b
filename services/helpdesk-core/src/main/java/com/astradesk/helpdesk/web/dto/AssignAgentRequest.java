package com.astradesk.helpdesk.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Payload for owner and responsible assignment.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AssignAgentRequest {

    private Long agentId;

    public AssignAgentRequest() {
    }

    public AssignAgentRequest(Long agentId) {
        this.agentId = agentId;
    }

    public Long getAgentId() {
        return agentId;
    }

    public void setAgentId(Long agentId) {
        this.agentId = agentId;
    }
}
