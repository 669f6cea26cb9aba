package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration validator that enforces business rules and constraints
 * beyond basic JSR-303 validation. Collects every violation, then fails fast.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  static final int MIN_API_KEY_LENGTH = 32;

  private static final String PROD_PROFILE = "prod";
  private static final List<String> DEV_KEY_MARKERS = List.of("dev_", "changeme");

  private final ApplicationProperties properties;
  private final Environment environment;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = validate();

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  List<String> validate() {
    List<String> errors = new ArrayList<>();
    validateSessionConfig(errors);
    validateKeyConfig(errors);
    validateInternalConfig(errors);
    return errors;
  }

  private void validateSessionConfig(List<String> errors) {
    ApplicationProperties.SessionProperties session = properties.session();
    Duration idle = session.idleTimeout();
    Duration absolute = session.absoluteTimeout();
    Duration tracking = session.trackingTtl();

    if (!isPositive(idle)) {
      errors.add("Session idle timeout must be positive: " + idle);
    }
    if (!isPositive(absolute)) {
      errors.add("Session absolute timeout must be positive: " + absolute);
    }
    if (isPositive(idle) && isPositive(absolute) && idle.compareTo(absolute) >= 0) {
      errors.add("Idle timeout (%s) must be less than absolute timeout (%s)".formatted(idle, absolute));
    }
    if (tracking == null || (absolute != null && tracking.compareTo(absolute) < 0)) {
      errors.add("Session tracking TTL (%s) must be at least the absolute timeout (%s)".formatted(tracking, absolute));
    }
  }

  private void validateKeyConfig(List<String> errors) {
    ApplicationProperties.KeyProperties keys = properties.keys();
    List<String> prefixes = List.of(
        nullToEmpty(keys.sessionPrefix()),
        nullToEmpty(keys.indexPrefix()),
        nullToEmpty(keys.ownerPrefix()),
        nullToEmpty(keys.rateLimitPrefix()));

    Set<String> seen = new HashSet<>();
    for (String prefix : prefixes) {
      if (prefix.isBlank()) {
        errors.add("Store key prefixes under 'app.keys' must not be blank.");
      } else if (!seen.add(prefix)) {
        errors.add("Store key prefix '%s' is used more than once under 'app.keys'.".formatted(prefix));
      }
    }
  }

  private void validateInternalConfig(List<String> errors) {
    String apiKey = properties.internal() != null ? nullToEmpty(properties.internal().apiKey()) : "";
    if (apiKey.length() < MIN_API_KEY_LENGTH) {
      errors.add("Internal API key must be at least %d characters.".formatted(MIN_API_KEY_LENGTH));
    }
    if (environment.acceptsProfiles(Profiles.of(PROD_PROFILE))) {
      String lowered = apiKey.toLowerCase(Locale.ROOT);
      if (DEV_KEY_MARKERS.stream().anyMatch(lowered::contains)) {
        errors.add("Internal API key looks like a development value and cannot be used in production.");
      }
    }
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isNegative() && !duration.isZero();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
