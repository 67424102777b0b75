package io.upreview.backend.token;

import io.upreview.backend.token.TokenVerification.Rejected;
import io.upreview.backend.token.TokenVerification.Verified;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;
import java.util.UUID;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;

/**
 * Verifies review link tokens against the (business, recipient) pair supplied by the caller.
 * Stateless and safe to call from any number of requests concurrently.
 */
@Component
public class ReviewLinkTokenVerifier {

  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private final ReviewLinkTokenCodec codec;
  private final Clock clock;

  public ReviewLinkTokenVerifier(ReviewLinkTokenCodec codec, Clock clock) {
    this.codec = codec;
    this.clock = clock;
  }

  /**
   * Checks signature, expiry and scope of a token.
   *
   * <p>The preview recipient always verifies, whatever the token contains, so that template
   * previews work without a real recipient.
   *
   * @param token raw token from the link
   * @param expectedBusinessId business the caller claims the link is for
   * @param expectedRecipientId recipient the caller claims the link is for
   * @return {@link Verified} or {@link Rejected} with a stable reason
   */
  public TokenVerification verify(
      String token, UUID expectedBusinessId, String expectedRecipientId) {
    if (PreviewRecipient.matches(expectedRecipientId)) {
      var payload =
          new TokenPayload(
              expectedBusinessId.toString(), PreviewRecipient.ID, clock.millis() + 60_000L);
      return new Verified(payload, true);
    }

    if (token == null) {
      return new Rejected(TokenRejection.MALFORMED_TOKEN);
    }
    int separator = token.lastIndexOf('.');
    if (separator <= 0 || separator == token.length() - 1) {
      return new Rejected(TokenRejection.MALFORMED_TOKEN);
    }
    String payloadPart = token.substring(0, separator);
    String signaturePart = token.substring(separator + 1);

    byte[] payloadBytes = decodeCanonical(payloadPart);
    byte[] signature = decodeCanonical(signaturePart);
    if (payloadBytes == null || signature == null) {
      return new Rejected(TokenRejection.MALFORMED_TOKEN);
    }

    if (!signatureMatches(payloadBytes, signature)) {
      return new Rejected(TokenRejection.BAD_SIGNATURE);
    }

    TokenPayload payload;
    try {
      payload = codec.readPayload(payloadBytes);
    } catch (JacksonException e) {
      return new Rejected(TokenRejection.MALFORMED_TOKEN);
    }
    if (payload == null
        || payload.businessId() == null
        || payload.recipientId() == null
        || payload.expiresAt() == null) {
      return new Rejected(TokenRejection.MALFORMED_TOKEN);
    }

    if (expiresAtMillis(payload.expiresAt()) <= clock.millis()) {
      return new Rejected(TokenRejection.EXPIRED);
    }

    if (!payload.businessId().equals(expectedBusinessId.toString())
        || !payload.recipientId().equals(expectedRecipientId)) {
      return new Rejected(TokenRejection.SCOPE_MISMATCH);
    }

    return new Verified(payload, false);
  }

  private boolean signatureMatches(byte[] payloadBytes, byte[] signature) {
    boolean matched = false;
    // no early exit: every accepted key is compared
    for (byte[] key : codec.verificationKeys()) {
      matched |= MessageDigest.isEqual(ReviewLinkTokenCodec.sign(payloadBytes, key), signature);
    }
    return matched;
  }

  /** Positive values below the millis floor are epoch seconds. Zero and below never verify. */
  private static long expiresAtMillis(long expiresAt) {
    if (expiresAt <= 0) {
      return Long.MIN_VALUE;
    }
    if (expiresAt < ReviewLinkTokenCodec.MIN_EXPIRES_AT_MILLIS) {
      return Math.multiplyExact(expiresAt, 1000L);
    }
    return expiresAt;
  }

  /**
   * Decodes an unpadded base64url segment. Returns null unless the segment is the canonical
   * encoding of its bytes (the JDK decoder ignores unused trailing bits).
   */
  private static byte[] decodeCanonical(String segment) {
    try {
      byte[] bytes = DECODER.decode(segment);
      return ENCODER.encodeToString(bytes).equals(segment) ? bytes : null;
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
