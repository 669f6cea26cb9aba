package com.example.sessionguard.adapter.redis.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.lettuce.core.resource.ClientResources;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

@ExtendWith(MockitoExtension.class)
class RedisConnectionManagerTest {

  @Mock
  private LettuceConnectionFactory connectionFactory;

  @Mock
  private ClientResources clientResources;

  private RedisConnectionManager manager;

  @BeforeEach
  void setUp() {
    manager = new RedisConnectionManager(connectionFactory, clientResources, Duration.ofMillis(200));
  }

  @Test
  @DisplayName("disconnects gracefully when the store answers")
  void gracefulClose() {
    manager.close();

    verify(connectionFactory).destroy();
    verify(clientResources, never()).shutdown(anyLong(), anyLong(), any(TimeUnit.class));
    assertThat(manager.isClosed()).isTrue();
  }

  @Test
  @DisplayName("forces shutdown when the graceful disconnect fails")
  void forcesOnFailure() {
    willThrow(new IllegalStateException("quit failed")).given(connectionFactory).destroy();

    manager.close();

    verify(clientResources).shutdown(0, 0, TimeUnit.MILLISECONDS);
  }

  @Test
  @DisplayName("forces shutdown when the graceful disconnect hangs")
  void forcesOnTimeout() {
    CountDownLatch release = new CountDownLatch(1);
    willAnswer(invocation -> {
      release.await(5, TimeUnit.SECONDS);
      return null;
    }).given(connectionFactory).destroy();

    try {
      manager.close();
    } finally {
      release.countDown();
    }

    verify(clientResources).shutdown(0, 0, TimeUnit.MILLISECONDS);
  }

  @Test
  @DisplayName("closes only once")
  void idempotent() {
    manager.close();
    manager.close();

    verify(connectionFactory, times(1)).destroy();
  }
}
