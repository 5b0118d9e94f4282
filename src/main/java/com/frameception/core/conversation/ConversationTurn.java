package com.frameception.core.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One exchange of the project conversation: the user's prompt and the backend's reply.
 */
public record ConversationTurn(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("user_text") String userText,
    @JsonProperty("bot_text") String botText,
    @JsonProperty("is_error") boolean error,
    Instant timestamp
) {}
