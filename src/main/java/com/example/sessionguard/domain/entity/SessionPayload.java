package com.example.sessionguard.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Represents the JSON document stored at {@code sess:{sessionId}}.
 * Mirrors the data written by the session store, versioned so historical payloads can be told apart.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionPayload(
    /**
     * Schema version. Absent in payloads written before versioning, which read as {@link #LEGACY_VERSION}.
     */
    Integer version,

    /**
     * The owning identity. A payload without a user id does not match the schema.
     */
    SessionUser user,

    /**
     * Creation timestamp in epoch milliseconds; drives the absolute timeout.
     */
    Long createdAt,

    /**
     * CSRF token issued together with the session.
     */
    String csrfToken
) {

  public static final int LEGACY_VERSION = 0;
  public static final int CURRENT_VERSION = 1;

  public static SessionPayload create(SessionUser user, long createdAt, String csrfToken) {
    return new SessionPayload(CURRENT_VERSION, user, createdAt, csrfToken);
  }

  @JsonIgnore
  public int schemaVersion() {
    return version != null ? version : LEGACY_VERSION;
  }

  @JsonIgnore
  public String ownerId() {
    return user != null ? user.id() : null;
  }

  @JsonIgnore
  public boolean hasCreatedAt() {
    return createdAt != null;
  }
}
