package com.example.sessionguard.web.rest.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * One attempt at a throttled action. The identity is normalized (trimmed, lower-cased) before use.
 */
public record RateLimitAttemptRequest(
    @NotBlank(message = "identity is required")
    @Size(max = 320, message = "identity must be at most 320 characters")
    String identity
) {}
