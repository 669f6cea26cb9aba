package com.example.sessionguard.domain.policy;

import com.example.sessionguard.properties.ApplicationProperties;
import java.time.Duration;

/**
 * Session lifetimes.
 *
 * @param idleTimeout     store-managed expiry of a session record, re-armed on writes only
 * @param absoluteTimeout maximum age measured from {@code createdAt}
 * @param trackingTtl     expiry of the per-user index and owner pointers
 */
public record SessionPolicy(
    Duration idleTimeout,
    Duration absoluteTimeout,
    Duration trackingTtl
) {

  public static SessionPolicy defaults() {
    return new SessionPolicy(Duration.ofHours(1), Duration.ofDays(14), Duration.ofDays(14));
  }

  public static SessionPolicy from(ApplicationProperties.SessionProperties session) {
    return new SessionPolicy(session.idleTimeout(), session.absoluteTimeout(), session.trackingTtl());
  }
}
