package com.example.sessionguard.adapter.redis.client;

import com.example.sessionguard.adapter.redis.dto.RedisHealthResponse;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis Health Check Client. Never throws: failures come back as an unhealthy response.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisHealthClient {

  private static final String PONG = "PONG";

  private final RedisTemplate<String, String> redisTemplate;

  public RedisHealthResponse checkHealth() {
    long startTime = System.currentTimeMillis();

    try {
      String pingResponse = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
      if (!PONG.equals(pingResponse)) {
        return RedisHealthResponse.unhealthy("Invalid PING response: " + pingResponse);
      }

      long responseTime = System.currentTimeMillis() - startTime;
      Properties info = serverInfo();
      return RedisHealthResponse.healthy(
          responseTime,
          info.getProperty("redis_version", "unknown"),
          parseInteger(info.getProperty("connected_clients", "0")));

    } catch (DataAccessException e) {
      log.error("Redis health check failed", e);
      return RedisHealthResponse.unhealthy(e.getMessage());
    }
  }

  private Properties serverInfo() {
    try {
      Properties info = redisTemplate.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info());
      return info != null ? info : new Properties();
    } catch (DataAccessException e) {
      log.warn("Failed to read Redis INFO", e);
      return new Properties();
    }
  }

  private int parseInteger(String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
