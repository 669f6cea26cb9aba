package com.example.sessionguard.domain.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Session User - the authenticated identity embedded in a session payload.
 * Field names match the JSON written by earlier deployments.
 */
public record SessionUser(
    String id,
    String email,
    @JsonProperty("is_global_admin") boolean globalAdmin,
    @JsonProperty("email_verified") boolean emailVerified,
    @JsonProperty("has_staff_role") boolean staffRole
) {}
