package com.optura.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/tasks/{id}/reject.
 */
public record RejectionRequest(
    @JsonProperty("rejected_by") String rejectedBy,
    @JsonProperty("rejection_reason") String rejectionReason
) {}
