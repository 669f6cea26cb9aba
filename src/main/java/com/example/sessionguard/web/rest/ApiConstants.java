package com.example.sessionguard.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String AUTH_BASE = "/auth";
    public static final String INTERNAL_BASE = "/internal";
    public static final String API_BASE = "/api";
    public static final String HEALTH_BASE = "/health";

    // Auth paths
    public static final String LOGOUT = "/logout";
    public static final String STATUS = "/status";

    // Session paths
    public static final String SESSION = "/session";
    public static final String ME = "/me";

    // Internal paths
    public static final String RATE_LIMIT_ATTEMPTS = "/rate-limits/{purpose}/attempts";
    public static final String RATE_LIMIT_REMAINING = "/rate-limits/{purpose}/remaining";
    public static final String SESSIONS = "/sessions";
    public static final String USER_SESSIONS = "/users/{userId}/sessions";
    public static final String USER_SESSION = "/users/{userId}/sessions/{sessionId}";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
