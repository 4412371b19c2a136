package com.optura.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/tasks/{id}/approve.
 */
public record ApprovalRequest(
    @JsonProperty("approved_by") String approvedBy
) {}
