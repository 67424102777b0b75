package io.upreview.backend.token;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.databind.json.JsonMapper;

/**
 * Mints review link tokens of the form {@code base64url(payload).base64url(HMAC-SHA256(payload))}.
 * Tokens carry no nonce: minting the same triple twice yields the same token. Replay inside the TTL
 * is bounded by the recipient action guards, not by the token.
 */
@Component
public class ReviewLinkTokenCodec {

  private static final Logger log = LoggerFactory.getLogger(ReviewLinkTokenCodec.class);
  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final JsonMapper PAYLOAD_MAPPER = JsonMapper.builder().build();

  /**
   * Smallest expiry written to a token. Smaller values are read back as epoch seconds, so earlier
   * instants are clamped here and still read as already expired.
   */
  static final long MIN_EXPIRES_AT_MILLIS = 1_000_000_000_000L;

  private final List<byte[]> verificationKeys;
  private final Clock clock;

  public ReviewLinkTokenCodec(ReviewLinkProperties properties, Clock clock) {
    if (properties.secret() == null || properties.secret().isBlank()) {
      throw new IllegalStateException("upreview.review-links.secret must be configured");
    }
    var keys = new ArrayList<byte[]>(2);
    keys.add(properties.secret().getBytes(StandardCharsets.UTF_8));
    if (properties.previousSecret() != null && !properties.previousSecret().isBlank()) {
      keys.add(properties.previousSecret().getBytes(StandardCharsets.UTF_8));
      log.info("Review link verification accepts a previous secret during rotation");
    }
    this.verificationKeys = List.copyOf(keys);
    this.clock = clock;
  }

  /**
   * Mints a token scoped to one business and one recipient.
   *
   * @param businessId tenant the link belongs to
   * @param recipientId recipient UUID string, or {@link PreviewRecipient#ID}
   * @param ttl lifetime from now; a negative value produces an already-expired token
   * @return the opaque, URL-safe token
   * @throws IllegalArgumentException if the resulting expiry cannot be represented in epoch millis
   */
  public String mint(UUID businessId, String recipientId, Duration ttl) {
    long expiresAt;
    try {
      expiresAt = Math.addExact(clock.millis(), ttl.toMillis());
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Token TTL out of range: " + ttl, e);
    }
    return encode(new TokenPayload(businessId.toString(), recipientId, clampExpiry(expiresAt)));
  }

  /** Mints a token that expires at a fixed instant. */
  public String mintUntil(UUID businessId, String recipientId, Instant expiresAt) {
    long millis;
    try {
      millis = expiresAt.toEpochMilli();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Token expiry out of range: " + expiresAt, e);
    }
    return encode(new TokenPayload(businessId.toString(), recipientId, clampExpiry(millis)));
  }

  private static long clampExpiry(long expiresAtMillis) {
    return Math.max(expiresAtMillis, MIN_EXPIRES_AT_MILLIS);
  }

  String encode(TokenPayload payload) {
    byte[] payloadBytes = PAYLOAD_MAPPER.writeValueAsBytes(payload);
    byte[] signature = sign(payloadBytes, verificationKeys.get(0));
    return ENCODER.encodeToString(payloadBytes) + "." + ENCODER.encodeToString(signature);
  }

  TokenPayload readPayload(byte[] payloadBytes) {
    return PAYLOAD_MAPPER.readValue(payloadBytes, TokenPayload.class);
  }

  /** Keys accepted for verification, current secret first. */
  List<byte[]> verificationKeys() {
    return verificationKeys;
  }

  static byte[] sign(byte[] payloadBytes, byte[] key) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
      return mac.doFinal(payloadBytes);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("HMAC-SHA256 not available", e);
    }
  }
}
