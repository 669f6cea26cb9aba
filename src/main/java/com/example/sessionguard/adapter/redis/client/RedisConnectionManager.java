package com.example.sessionguard.adapter.redis.client;

import com.example.sessionguard.properties.ApplicationProperties;
import io.lettuce.core.resource.ClientResources;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the store connection's shutdown.
 * <p>
 * {@link #close()} first disconnects gracefully, bounded by the configured shutdown timeout. If
 * that fails or hangs, the shared Lettuce resources are shut down with no quiet period.
 */
@Slf4j
@Component
public class RedisConnectionManager implements AutoCloseable {

  private final LettuceConnectionFactory connectionFactory;
  private final ClientResources clientResources;
  private final Duration shutdownTimeout;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public RedisConnectionManager(
      LettuceConnectionFactory connectionFactory,
      ClientResources clientResources,
      ApplicationProperties properties) {
    this(connectionFactory, clientResources, properties.redis().shutdownTimeout());
  }

  RedisConnectionManager(
      LettuceConnectionFactory connectionFactory, ClientResources clientResources, Duration shutdownTimeout) {
    this.connectionFactory = connectionFactory;
    this.clientResources = clientResources;
    this.shutdownTimeout = shutdownTimeout;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }

    CompletableFuture<Void> graceful = CompletableFuture.runAsync(connectionFactory::destroy);
    try {
      graceful.get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
      log.info("Redis connection closed");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      forceDisconnect(e);
    } catch (ExecutionException | TimeoutException e) {
      forceDisconnect(e);
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  private void forceDisconnect(Exception cause) {
    log.warn("Graceful Redis disconnect did not complete; forcing shutdown", cause);
    try {
      clientResources.shutdown(0, 0, TimeUnit.MILLISECONDS);
    } catch (RuntimeException e) {
      log.error("Forced Redis shutdown failed", e);
    }
  }
}
