package com.example.sessionguard.util;

import com.example.sessionguard.domain.entity.SessionPayload;
import com.example.sessionguard.exception.SessionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads and writes the JSON session payload.
 * <p>
 * Stored payloads are untrusted: anything that is not a JSON object with a non-blank
 * {@code user.id} decodes to {@link Optional#empty()} instead of failing.
 */
@Slf4j
@Component
public class SessionPayloadCodec {

  private static final String CREATED_AT_FIELD = "createdAt";

  private final ObjectMapper objectMapper;
  private final ObjectReader payloadReader;

  public SessionPayloadCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.payloadReader = objectMapper.readerFor(SessionPayload.class)
        .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .without(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
  }

  public String encode(SessionPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new SessionException("Failed to serialize session payload", e);
    }
  }

  public Optional<SessionPayload> decode(String json) {
    if (!StringUtils.hasText(json)) {
      return Optional.empty();
    }
    try {
      SessionPayload payload = payloadReader.readValue(json);
      if (payload == null || !StringUtils.hasText(payload.ownerId()) || payload.schemaVersion() < 0) {
        return Optional.empty();
      }
      return Optional.of(payload);
    } catch (JsonProcessingException | RuntimeException e) {
      log.trace("Ignoring session payload that does not match the schema: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Add {@code createdAt} to a stored payload. The document is edited as a tree, so fields this
   * service does not model survive unchanged. Empty when the payload does not match the schema.
   */
  public Optional<String> stampCreatedAt(String json, long createdAt) {
    if (decode(json).isEmpty()) {
      return Optional.empty();
    }
    try {
      JsonNode tree = objectMapper.readTree(json);
      if (!(tree instanceof ObjectNode document)) {
        return Optional.empty();
      }
      document.put(CREATED_AT_FIELD, createdAt);
      return Optional.of(objectMapper.writeValueAsString(document));
    } catch (JsonProcessingException e) {
      log.trace("Could not stamp session payload: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Owning user id of a stored payload, or empty when the payload is malformed.
   */
  public Optional<String> readOwner(String json) {
    return decode(json).map(SessionPayload::ownerId);
  }
}
