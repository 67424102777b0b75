package io.upreview.backend.token;

/** Outcome of {@link ReviewLinkTokenVerifier#verify}. */
public sealed interface TokenVerification {

  /**
   * The token is authentic, unexpired and scoped to the expected pair.
   *
   * @param payload the decoded token body
   * @param preview true when the expected recipient is the preview sentinel
   */
  record Verified(TokenPayload payload, boolean preview) implements TokenVerification {}

  record Rejected(TokenRejection reason) implements TokenVerification {}

  default boolean isVerified() {
    return this instanceof Verified;
  }
}
