package com.example.sessionguard.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.sessionguard.domain.entity.CreatedSession;
import com.example.sessionguard.domain.entity.RevocationOutcome;
import com.example.sessionguard.domain.entity.RevocationOutcome.RevocationPath;
import com.example.sessionguard.domain.entity.SessionPayload;
import com.example.sessionguard.domain.entity.SessionUser;
import com.example.sessionguard.domain.policy.RateLimitPolicies;
import com.example.sessionguard.domain.policy.RevocationPolicy;
import com.example.sessionguard.domain.policy.SessionKeys;
import com.example.sessionguard.domain.policy.SessionPolicy;
import com.example.sessionguard.service.RateLimiterService;
import com.example.sessionguard.service.SessionIndexService;
import com.example.sessionguard.service.SessionRevocationService;
import com.example.sessionguard.service.SessionService;
import com.example.sessionguard.util.SessionPayloadCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Runs the services against a real Redis. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisSessionGuardIntegrationTest {

  private static final int REDIS_PORT = 6379;

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(REDIS_PORT);

  private static LettuceConnectionFactory connectionFactory;
  private static StringRedisTemplate redisTemplate;

  private final SessionKeys keys = SessionKeys.defaults();
  private final SessionPayloadCodec codec = new SessionPayloadCodec(new ObjectMapper());

  @BeforeAll
  static void connect() {
    connectionFactory = new LettuceConnectionFactory(
        new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(REDIS_PORT)));
    connectionFactory.afterPropertiesSet();
    connectionFactory.start();
    redisTemplate = new StringRedisTemplate(connectionFactory);
  }

  @AfterAll
  static void disconnect() {
    connectionFactory.destroy();
  }

  @BeforeEach
  void flush() {
    redisTemplate.execute(connection -> {
      connection.serverCommands().flushDb();
      return null;
    }, true);
  }

  @Test
  @DisplayName("fixed window admits the limit, denies, then resets after the window")
  void fixedWindowResets() throws InterruptedException {
    // given
    RateLimiterService limiter = new RateLimiterService(redisTemplate, keys, RateLimitPolicies.defaults());

    // when / then
    assertThat(limiter.isAllowed("login:a@example.com", 3, 1000)).isTrue();
    assertThat(limiter.isAllowed("login:a@example.com", 3, 1000)).isTrue();
    assertThat(limiter.isAllowed("login:a@example.com", 3, 1000)).isTrue();
    assertThat(limiter.isAllowed("login:a@example.com", 3, 1000)).isFalse();
    assertThat(redisTemplate.getExpire(keys.rateLimit("login:a@example.com"))).isBetween(0L, 1L);

    Thread.sleep(1200);

    assertThat(limiter.isAllowed("login:a@example.com", 3, 1000)).isTrue();
    assertThat(limiter.getRemainingAttempts("login:a@example.com", 3)).isEqualTo(2);
  }

  @Test
  @DisplayName("a burst straddling the window boundary can exceed the limit")
  void boundaryBurst() throws InterruptedException {
    // given
    RateLimiterService limiter = new RateLimiterService(redisTemplate, keys, RateLimitPolicies.defaults());
    String key = "login:burst@example.com";
    assertThat(limiter.isAllowed(key, 3, 1000)).isTrue();
    Thread.sleep(800);

    // when
    long burstStart = System.currentTimeMillis();
    int admitted = 0;
    for (int i = 0; i < 2; i++) {
      if (limiter.isAllowed(key, 3, 1000)) {
        admitted++;
      }
    }
    awaitExpiry(keys.rateLimit(key));
    for (int i = 0; i < 3; i++) {
      if (limiter.isAllowed(key, 3, 1000)) {
        admitted++;
      }
    }
    long burstMillis = System.currentTimeMillis() - burstStart;

    // then
    assertThat(admitted).isEqualTo(5);
    assertThat(burstMillis).isLessThan(1000);
  }

  @Test
  @DisplayName("indexed revocation removes every tracked session")
  void indexedRevocation() {
    // given
    SessionPolicy policy = SessionPolicy.defaults();
    SessionIndexService index = new SessionIndexService(redisTemplate, keys, policy);
    SessionService sessions = new SessionService(redisTemplate, index, codec, keys, policy, Clock.systemUTC());
    SessionRevocationService revocation =
        new SessionRevocationService(redisTemplate, keys, new RevocationPolicy(false, 500, 100), codec);

    SessionUser user = new SessionUser("u1", "u1@example.com", false, true, false);
    CreatedSession first = sessions.createAuthenticatedSession(user);
    CreatedSession second = sessions.createAuthenticatedSession(user);
    CreatedSession other = sessions.createAuthenticatedSession(new SessionUser("u2", null, false, false, false));

    // when
    RevocationOutcome outcome = revocation.revoke("u1");

    // then
    assertThat(outcome.path()).isEqualTo(RevocationPath.INDEXED);
    assertThat(outcome.revoked()).isEqualTo(2);
    assertThat(sessions.findSession(first.sessionId())).isEmpty();
    assertThat(sessions.findSession(second.sessionId())).isEmpty();
    assertThat(sessions.findSession(other.sessionId())).isPresent();
    assertThat(redisTemplate.hasKey(keys.userIndex("u1"))).isFalse();
  }

  @Test
  @DisplayName("scan fallback stops at its budget and a larger budget finishes the job")
  void budgetedScan() {
    // given
    for (int i = 0; i < 30; i++) {
      writeUntrackedSession("other-" + i);
    }
    for (int i = 0; i < 3; i++) {
      writeUntrackedSession("u1");
    }

    // when
    RevocationOutcome limited =
        new SessionRevocationService(redisTemplate, keys, new RevocationPolicy(true, 10, 5), codec).revoke("u1");

    // then
    assertThat(limited.path()).isEqualTo(RevocationPath.SCAN_FALLBACK);
    assertThat(limited.inspectedKeys()).isEqualTo(10);
    assertThat(limited.budgetExhausted()).isTrue();

    // when
    RevocationOutcome full =
        new SessionRevocationService(redisTemplate, keys, new RevocationPolicy(true, 1000, 5), codec).revoke("u1");

    // then
    assertThat(full.budgetExhausted()).isFalse();
    assertThat(limited.revoked() + full.revoked()).isEqualTo(3);
    assertThat(redisTemplate.keys(keys.sessionPattern())).hasSize(30);
  }

  @Test
  @DisplayName("stamping createdAt keeps stored fields and never recreates a deleted session")
  void stampsInPlaceOnly() {
    // given
    SessionPolicy policy = SessionPolicy.defaults();
    SessionService sessions = new SessionService(
        redisTemplate, new SessionIndexService(redisTemplate, keys, policy), codec, keys, policy, Clock.systemUTC());
    String liveId = "bGl2ZVNlc3Npb25JZDAxMjM0NTY3ODkwMTIzNDU2Nzg";
    String revokedId = "cmV2b2tlZFNlc3Npb25JZDAxMjM0NTY3ODkwMTIzNDU";
    redisTemplate.opsForValue().set(keys.session(liveId),
        "{\"user\":{\"id\":\"u1\",\"tenant\":\"acme\"},\"returnTo\":\"/home\"}", Duration.ofMinutes(5));

    // when
    Optional<SessionPayload> stamped = sessions.stampCreatedAt(liveId, 1_700_000_000_000L);
    Optional<SessionPayload> revoked = sessions.stampCreatedAt(revokedId, 1_700_000_000_000L);

    // then
    assertThat(stamped).isPresent();
    assertThat(redisTemplate.opsForValue().get(keys.session(liveId)))
        .contains("\"tenant\":\"acme\"")
        .contains("\"returnTo\":\"/home\"")
        .contains("\"createdAt\":1700000000000");
    assertThat(redisTemplate.getExpire(keys.session(liveId))).isGreaterThan(Duration.ofMinutes(5).toSeconds());
    assertThat(revoked).isEmpty();
    assertThat(redisTemplate.hasKey(keys.session(revokedId))).isFalse();
  }

  private void writeUntrackedSession(String userId) {
    SessionPayload payload = SessionPayload.create(
        new SessionUser(userId, null, false, false, false), System.currentTimeMillis(), "csrf");
    redisTemplate.opsForValue().set(
        keys.session(UUID.randomUUID().toString()), codec.encode(payload), Duration.ofHours(1));
  }

  private void awaitExpiry(String key) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 2000;
    while (Boolean.TRUE.equals(redisTemplate.hasKey(key)) && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
  }
}
