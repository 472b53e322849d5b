package com.astradesk.helpdesk.web.dto;

/**
 * Body of every failed request: a machine-checkable reason and the HTTP status.
 */
public record ErrorResponse(String error, int status) {
}
