package com.frameception.dispatch.api;

/**
 * Inbound JSON body for PUT /api/v1/dashboard/prompt.
 */
public record PromptRequest(String prompt) {}
