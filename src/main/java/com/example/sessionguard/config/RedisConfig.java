package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.SslOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.actuate.data.redis.RedisHealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis configuration with connection pooling.
 * Standalone only: the legacy revocation scan walks a single keyspace with SCAN.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class RedisConfig {

  private final ApplicationProperties properties;

  /**
   * Shared client resources for all Redis connections
   */
  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    return DefaultClientResources.builder()
        .ioThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .computationThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .build();
  }

  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    ApplicationProperties.RedisProperties.PoolProperties poolProps = properties.redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(poolProps.maxActive());
    config.setMaxIdle(poolProps.maxIdle());
    config.setMinIdle(poolProps.minIdle());
    config.setMaxWait(poolProps.maxWait());

    config.setTestOnBorrow(false);
    config.setTestWhileIdle(true);
    config.setTimeBetweenEvictionRuns(poolProps.timeBetweenEvictionRuns());
    config.setMinEvictableIdleDuration(Duration.ofMinutes(1));
    config.setNumTestsPerEvictionRun(3);

    return config;
  }

  @Bean
  public LettuceConnectionFactory redisConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();
    RedisURI redisUri = RedisURI.create(redisProps.url());

    RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
    redisConfig.setHostName(redisUri.getHost());
    redisConfig.setPort(redisUri.getPort());
    redisConfig.setDatabase(redisUri.getDatabase());
    if (redisUri.getUsername() != null) {
      redisConfig.setUsername(redisUri.getUsername());
    }
    if (redisUri.getPassword() != null && redisUri.getPassword().length > 0) {
      redisConfig.setPassword(RedisPassword.of(redisUri.getPassword()));
    }

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .commandTimeout(redisProps.timeout())
            .shutdownTimeout(redisProps.shutdownTimeout())
            .clientOptions(createClientOptions(redisProps.timeout(), redisUri.isSsl()));

    if (redisUri.isSsl()) {
      builder.useSsl();
    }

    LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfig, builder.build());
    factory.setShareNativeConnection(true);
    factory.setValidateConnection(false);

    log.info("Configured Redis at {}:{} (db {}, tls={})",
             redisUri.getHost(), redisUri.getPort(), redisUri.getDatabase(), redisUri.isSsl());
    return factory;
  }

  /**
   * Primary Redis template for string keys and values
   */
  @Bean
  @Primary
  public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
    RedisTemplate<String, String> template = new RedisTemplate<>();
    template.setConnectionFactory(connectionFactory);

    StringRedisSerializer stringSerializer = new StringRedisSerializer();
    template.setKeySerializer(stringSerializer);
    template.setValueSerializer(stringSerializer);
    template.setHashKeySerializer(stringSerializer);
    template.setHashValueSerializer(stringSerializer);

    // Pipelines only; no MULTI/EXEC
    template.setEnableTransactionSupport(false);
    template.afterPropertiesSet();
    return template;
  }

  @Bean
  public RedisHealthIndicator redisHealthIndicator(RedisConnectionFactory connectionFactory) {
    return new RedisHealthIndicator(connectionFactory);
  }

  private ClientOptions createClientOptions(Duration timeout, boolean ssl) {
    ClientOptions.Builder builder = ClientOptions.builder()
        .socketOptions(SocketOptions.builder()
                           .connectTimeout(timeout)
                           .keepAlive(true)
                           .tcpNoDelay(true)
                           .build())
        // Fail fast while disconnected so rate-limit checks and revocations fail closed
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .cancelCommandsOnReconnectFailure(false)
        .pingBeforeActivateConnection(true)
        .timeoutOptions(TimeoutOptions.enabled(timeout));

    if (ssl) {
      builder.sslOptions(SslOptions.builder().jdkSslProvider().build());
    }

    return builder.build();
  }
}
