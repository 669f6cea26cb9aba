package com.example.sessionguard.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Centralized configuration properties for the Session Guard application.
 * Read once at startup and converted into immutable policies by SessionGuardConfig.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @DefaultValue @NotNull @Valid RedisProperties redis,
    @DefaultValue @NotNull @Valid SessionProperties session,
    @DefaultValue @NotNull @Valid KeyProperties keys,
    @DefaultValue @NotNull @Valid RateLimitProperties rateLimit,
    @NotNull @Valid InternalApiProperties internal
) {

  /**
   * Redis connection configuration. A {@code rediss://} URL enables TLS.
   */
  public record RedisProperties(
      @DefaultValue("redis://localhost:6379") @NotBlank String url,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration shutdownTimeout,
      @DefaultValue @NotNull @Valid PoolProperties pool
  ) {
    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("4") @PositiveOrZero int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }

  /**
   * Session lifetime, cookie and revocation configuration
   */
  public record SessionProperties(
      @DefaultValue("1h") Duration idleTimeout,
      @DefaultValue("14d") Duration absoluteTimeout,
      @DefaultValue("14d") Duration trackingTtl,
      @DefaultValue @NotNull @Valid CookieProperties cookie,
      @DefaultValue @NotNull @Valid RevocationProperties revocation
  ) {
    public record CookieProperties(
        @DefaultValue("sid") @NotBlank String name,
        @DefaultValue("false") boolean secure,
        String domain,
        @DefaultValue("Lax") @Pattern(regexp = "Strict|Lax|None") String sameSite
    ) {}

    public record RevocationProperties(
        @DefaultValue("false") boolean scanFallbackEnabled,
        @DefaultValue("5000") @Positive int scanMaxKeys,
        @DefaultValue("100") @Positive int scanPageSize
    ) {}
  }

  /**
   * Store key prefixes. These are part of the wire contract with Redis: changing them
   * orphans every session and index written by earlier deployments.
   */
  public record KeyProperties(
      @DefaultValue("sess:") @NotBlank String sessionPrefix,
      @DefaultValue("user_sessions:") @NotBlank String indexPrefix,
      @DefaultValue("session_user:") @NotBlank String ownerPrefix,
      @DefaultValue("ratelimit:") @NotBlank String rateLimitPrefix
  ) {}

  /**
   * Fixed-window policies for the throttled actions. Unset values fall back to the
   * defaults carried by {@link com.example.sessionguard.domain.entity.RateLimitPurpose}.
   */
  public record RateLimitProperties(
      @DefaultValue @NotNull @Valid PolicyProperties login,
      @DefaultValue @NotNull @Valid PolicyProperties passwordReset,
      @DefaultValue @NotNull @Valid PolicyProperties emailVerification
  ) {
    public record PolicyProperties(
        @Positive Integer limit,
        Duration window
    ) {}
  }

  /**
   * Shared secret for the internal endpoints used by the auth-flow services
   */
  public record InternalApiProperties(
      @NotBlank String apiKey
  ) {}
}
