package com.example.sessionguard.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.sessionguard.domain.entity.SessionPayload;
import com.example.sessionguard.domain.entity.SessionUser;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class SessionPayloadCodecTest {

  private final SessionPayloadCodec codec = new SessionPayloadCodec(new ObjectMapper());

  @Nested
  @DisplayName("encode")
  class Encode {

    @Test
    @DisplayName("writes the versioned schema with snake_case user flags")
    void writesSchema() {
      SessionPayload payload = SessionPayload.create(
          new SessionUser("u1", "u1@example.com", true, true, false), 1_700_000_000_000L, "csrf-1");

      String json = codec.encode(payload);

      assertThat(json)
          .contains("\"version\":1")
          .contains("\"is_global_admin\":true")
          .contains("\"email_verified\":true")
          .contains("\"has_staff_role\":false")
          .contains("\"createdAt\":1700000000000")
          .contains("\"csrfToken\":\"csrf-1\"")
          .doesNotContain("ownerId")
          .doesNotContain("schemaVersion");
    }

    @Test
    @DisplayName("omits absent fields")
    void omitsNulls() {
      String json = codec.encode(new SessionPayload(null, new SessionUser("u1", null, false, false, false), null, null));

      assertThat(json).doesNotContain("version").doesNotContain("createdAt").doesNotContain("csrfToken");
    }
  }

  @Nested
  @DisplayName("decode")
  class Decode {

    @Test
    @DisplayName("reads a payload written before versioning as schema 0")
    void readsLegacyPayload() {
      String legacy = "{\"cookie\":{\"originalMaxAge\":3600000,\"httpOnly\":true},"
          + "\"user\":{\"id\":\"u9\",\"email\":\"u9@example.com\",\"is_global_admin\":false},"
          + "\"csrfToken\":\"abc\"}";

      Optional<SessionPayload> payload = codec.decode(legacy);

      assertThat(payload).isPresent();
      assertThat(payload.get().schemaVersion()).isEqualTo(SessionPayload.LEGACY_VERSION);
      assertThat(payload.get().ownerId()).isEqualTo("u9");
      assertThat(payload.get().hasCreatedAt()).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
        "   ",
        "{not json",
        "null",
        "42",
        "[]",
        "\"sess\"",
        "{}",
        "{\"user\":null}",
        "{\"user\":{}}",
        "{\"user\":{\"id\":\"\"}}",
        "{\"user\":{\"id\":\"  \"}}",
        "{\"user\":\"u1\"}"
    })
    @DisplayName("treats anything without a user id as unmatched")
    void unmatched(String json) {
      assertThat(codec.decode(json)).isEmpty();
      assertThat(codec.readOwner(json)).isEmpty();
    }

    @Test
    @DisplayName("reads the owner of a well-formed payload")
    void readsOwner() {
      assertThat(codec.readOwner("{\"version\":1,\"user\":{\"id\":\"owner-1\"},\"createdAt\":1}"))
          .contains("owner-1");
    }
  }

  @Nested
  @DisplayName("stampCreatedAt")
  class StampCreatedAt {

    @Test
    @DisplayName("keeps fields the schema does not model")
    void keepsUnknownFields() {
      String stored = "{\"version\":1,\"user\":{\"id\":\"u1\",\"tenant\":\"acme\",\"email_verified\":true},"
          + "\"csrfToken\":\"c\",\"flash\":[\"welcome\"]}";

      String stamped = codec.stampCreatedAt(stored, 1_700_000_000_000L).orElseThrow();

      assertThat(stamped)
          .isEqualTo("{\"version\":1,\"user\":{\"id\":\"u1\",\"tenant\":\"acme\",\"email_verified\":true},"
              + "\"csrfToken\":\"c\",\"flash\":[\"welcome\"],\"createdAt\":1700000000000}");
      assertThat(codec.decode(stamped).orElseThrow().createdAt()).isEqualTo(1_700_000_000_000L);
    }

    @Test
    @DisplayName("refuses payloads without a user id")
    void refusesUnmatched() {
      assertThat(codec.stampCreatedAt("{\"user\":{}}", 1L)).isEmpty();
      assertThat(codec.stampCreatedAt("{not json", 1L)).isEmpty();
    }
  }
}
