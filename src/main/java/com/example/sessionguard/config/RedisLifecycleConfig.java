package com.example.sessionguard.config;

import com.example.sessionguard.adapter.redis.client.RedisConnectionManager;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

/**
 * Redis Connection Lifecycle Configuration
 */
@Configuration
@RequiredArgsConstructor
public class RedisLifecycleConfig {

  private final RedisConnectionManager redisConnectionManager;

  @PreDestroy
  public void shutdown() {
    redisConnectionManager.close();
  }
}
