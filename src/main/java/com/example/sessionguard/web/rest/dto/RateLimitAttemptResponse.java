package com.example.sessionguard.web.rest.dto;

public record RateLimitAttemptResponse(String purpose, boolean allowed, int remaining) {}
