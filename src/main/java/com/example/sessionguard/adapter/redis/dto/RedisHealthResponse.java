package com.example.sessionguard.adapter.redis.dto;

/**
 * Redis Health Check Response
 */
public record RedisHealthResponse(
    boolean healthy,
    long responseTimeMs,
    String version,
    int connectedClients,
    String error
) {
  public static RedisHealthResponse healthy(long responseTimeMs, String version, int connectedClients) {
    return new RedisHealthResponse(true, responseTimeMs, version, connectedClients, null);
  }

  public static RedisHealthResponse unhealthy(String error) {
    return new RedisHealthResponse(false, 0, null, 0, error);
  }
}
