package com.loanrecon.api.dto;

/**
 * 202 body for re-run requests. {@code executionId} is null for compliance re-runs.
 */
public record RunAcceptedResponse(String executionId, String message) {
}
