package io.upreview.backend.token;

import static io.upreview.backend.token.ReviewLinkTokenCodecTest.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.upreview.backend.token.TokenVerification.Rejected;
import io.upreview.backend.token.TokenVerification.Verified;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class ReviewLinkTokenVerifierTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final UUID BUSINESS_ID = UUID.fromString("6f1c2d9e-0b4a-4c1e-9d55-3a2b1c0d9e8f");
  private static final String RECIPIENT_ID = "0d7b9a3c-5e21-4f6a-8b90-1c2d3e4f5a6b";

  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
  private final ReviewLinkTokenCodec codec = new ReviewLinkTokenCodec(properties("s3cret"), clock);
  private final ReviewLinkTokenVerifier verifier = new ReviewLinkTokenVerifier(codec, clock);

  @Test
  void freshly_minted_token_verifies_for_its_own_pair() {
    String token = codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofDays(7));

    var result = verifier.verify(token, BUSINESS_ID, RECIPIENT_ID);

    assertThat(result).isInstanceOf(Verified.class);
    var verified = (Verified) result;
    assertThat(verified.preview()).isFalse();
    assertThat(verified.payload().businessId()).isEqualTo(BUSINESS_ID.toString());
    assertThat(verified.payload().recipientId()).isEqualTo(RECIPIENT_ID);
    assertThat(verified.payload().expiresAt())
        .isEqualTo(NOW.plus(Duration.ofDays(7)).toEpochMilli());
  }

  @Test
  void changing_any_single_character_is_rejected() {
    String token = codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofDays(7));

    for (int i = 0; i < token.length(); i++) {
      char original = token.charAt(i);
      char replacement = original == 'A' ? 'B' : 'A';
      String tampered = token.substring(0, i) + replacement + token.substring(i + 1);

      assertThat(verifier.verify(tampered, BUSINESS_ID, RECIPIENT_ID).isVerified())
          .as("tampered at index %d", i)
          .isFalse();
    }
  }

  @Test
  void tampered_signature_is_a_bad_signature() {
    String token = codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofDays(7));
    String otherSignature = codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofDays(8));
    String forged =
        token.substring(0, token.indexOf('.'))
            + otherSignature.substring(otherSignature.indexOf('.'));

    assertThat(verifier.verify(forged, BUSINESS_ID, RECIPIENT_ID))
        .isEqualTo(new Rejected(TokenRejection.BAD_SIGNATURE));
  }

  @Test
  void negative_ttl_yields_an_expired_token() {
    String token = codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofMillis(-1));

    assertThat(verifier.verify(token, BUSINESS_ID, RECIPIENT_ID))
        .isEqualTo(new Rejected(TokenRejection.EXPIRED));
  }

  @Test
  void token_expiring_exactly_now_is_expired() {
    String token = codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ZERO);

    assertThat(verifier.verify(token, BUSINESS_ID, RECIPIENT_ID))
        .isEqualTo(new Rejected(TokenRejection.EXPIRED));
  }

  @Test
  void ttl_reaching_back_before_the_millis_floor_is_still_expired() {
    String token = codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofDays(-365L * 30));

    var result = verifier.verify(token, BUSINESS_ID, RECIPIENT_ID);

    assertThat(result).isEqualTo(new Rejected(TokenRejection.EXPIRED));
  }

  @Test
  void expiry_before_the_millis_floor_is_written_as_the_floor() {
    String token =
        codec.mintUntil(BUSINESS_ID, RECIPIENT_ID, Instant.parse("1996-03-08T10:00:00Z"));

    TokenPayload payload =
        codec.readPayload(Base64.getUrlDecoder().decode(token.substring(0, token.indexOf('.'))));
    assertThat(payload.expiresAt()).isEqualTo(ReviewLinkTokenCodec.MIN_EXPIRES_AT_MILLIS);
  }

  @Test
  void unrepresentable_ttl_is_refused_at_mint() {
    assertThatThrownBy(
            () -> codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofMillis(Long.MAX_VALUE - 1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofSeconds(Long.MAX_VALUE / 10)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @ParameterizedTest
  @ValueSource(longs = {0L, -1L, -9_223_370_264_495_575_810L, Long.MIN_VALUE})
  void non_positive_expiry_is_expired(long expiresAt) {
    String token = codec.encode(new TokenPayload(BUSINESS_ID.toString(), RECIPIENT_ID, expiresAt));

    assertThat(verifier.verify(token, BUSINESS_ID, RECIPIENT_ID))
        .isEqualTo(new Rejected(TokenRejection.EXPIRED));
  }

  @Test
  void expiry_is_checked_before_scope() {
    String token = codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofMillis(-1));

    assertThat(verifier.verify(token, UUID.randomUUID(), RECIPIENT_ID))
        .isEqualTo(new Rejected(TokenRejection.EXPIRED));
  }

  @Test
  void token_for_another_recipient_is_a_scope_mismatch() {
    String token = codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofDays(7));

    assertThat(verifier.verify(token, BUSINESS_ID, UUID.randomUUID().toString()))
        .isEqualTo(new Rejected(TokenRejection.SCOPE_MISMATCH));
  }

  @Test
  void token_for_another_business_is_a_scope_mismatch() {
    String token = codec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofDays(7));

    assertThat(verifier.verify(token, UUID.randomUUID(), RECIPIENT_ID))
        .isEqualTo(new Rejected(TokenRejection.SCOPE_MISMATCH));
  }

  @ParameterizedTest
  @ValueSource(strings = {"garbage", "a.b", "", "not.a.token.at.all"})
  void preview_recipient_verifies_whatever_the_token(String token) {
    var result = verifier.verify(token, BUSINESS_ID, PreviewRecipient.ID);

    assertThat(result).isInstanceOf(Verified.class);
    assertThat(((Verified) result).preview()).isTrue();
  }

  @Test
  void preview_recipient_verifies_with_null_token() {
    assertThat(verifier.verify(null, BUSINESS_ID, PreviewRecipient.ID).isVerified()).isTrue();
  }

  @Test
  void expiry_in_epoch_seconds_is_accepted() {
    long expiresAtSeconds = NOW.getEpochSecond() + 3600;
    String token =
        codec.encode(new TokenPayload(BUSINESS_ID.toString(), RECIPIENT_ID, expiresAtSeconds));

    assertThat(verifier.verify(token, BUSINESS_ID, RECIPIENT_ID).isVerified()).isTrue();
  }

  @Test
  void expired_epoch_seconds_are_rejected() {
    long expiresAtSeconds = NOW.getEpochSecond() - 1;
    String token =
        codec.encode(new TokenPayload(BUSINESS_ID.toString(), RECIPIENT_ID, expiresAtSeconds));

    assertThat(verifier.verify(token, BUSINESS_ID, RECIPIENT_ID))
        .isEqualTo(new Rejected(TokenRejection.EXPIRED));
  }

  @Test
  void token_signed_with_previous_secret_verifies_during_rotation() {
    var oldCodec = new ReviewLinkTokenCodec(properties("old-secret"), clock);
    String token = oldCodec.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofDays(7));

    var rotated = new ReviewLinkTokenCodec(properties("new-secret", "old-secret"), clock);
    var rotatedVerifier = new ReviewLinkTokenVerifier(rotated, clock);
    var strictVerifier =
        new ReviewLinkTokenVerifier(
            new ReviewLinkTokenCodec(properties("new-secret"), clock), clock);

    assertThat(rotatedVerifier.verify(token, BUSINESS_ID, RECIPIENT_ID).isVerified()).isTrue();
    assertThat(strictVerifier.verify(token, BUSINESS_ID, RECIPIENT_ID))
        .isEqualTo(new Rejected(TokenRejection.BAD_SIGNATURE));
  }

  @Test
  void rotated_codec_mints_with_the_current_secret() {
    var rotated = new ReviewLinkTokenCodec(properties("new-secret", "old-secret"), clock);
    String token = rotated.mint(BUSINESS_ID, RECIPIENT_ID, Duration.ofDays(7));

    var currentOnly =
        new ReviewLinkTokenVerifier(
            new ReviewLinkTokenCodec(properties("new-secret"), clock), clock);
    assertThat(currentOnly.verify(token, BUSINESS_ID, RECIPIENT_ID).isVerified()).isTrue();
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"abc", "abc.", ".abc", "!!!.???", "a b.c d"})
  void structurally_broken_tokens_are_malformed(String token) {
    assertThat(verifier.verify(token, BUSINESS_ID, RECIPIENT_ID))
        .isEqualTo(new Rejected(TokenRejection.MALFORMED_TOKEN));
  }

  @Test
  void validly_signed_non_json_payload_is_malformed() {
    byte[] payload = "not json".getBytes(StandardCharsets.UTF_8);
    byte[] signature =
        ReviewLinkTokenCodec.sign(payload, "s3cret".getBytes(StandardCharsets.UTF_8));
    var encoder = Base64.getUrlEncoder().withoutPadding();
    String token = encoder.encodeToString(payload) + "." + encoder.encodeToString(signature);

    assertThat(verifier.verify(token, BUSINESS_ID, RECIPIENT_ID))
        .isEqualTo(new Rejected(TokenRejection.MALFORMED_TOKEN));
  }

  @Test
  void payload_missing_expiry_is_malformed() {
    String token = codec.encode(new TokenPayload(BUSINESS_ID.toString(), RECIPIENT_ID, null));

    assertThat(verifier.verify(token, BUSINESS_ID, RECIPIENT_ID))
        .isEqualTo(new Rejected(TokenRejection.MALFORMED_TOKEN));
  }
}
