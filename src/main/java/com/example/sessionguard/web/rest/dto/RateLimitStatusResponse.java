package com.example.sessionguard.web.rest.dto;

public record RateLimitStatusResponse(String purpose, int remaining, int limit) {}
