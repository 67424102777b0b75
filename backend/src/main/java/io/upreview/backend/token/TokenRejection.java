package io.upreview.backend.token;

/** Machine-readable reasons a review link token failed verification. Internal use only. */
public enum TokenRejection {
  MALFORMED_TOKEN,
  BAD_SIGNATURE,
  EXPIRED,
  SCOPE_MISMATCH
}
