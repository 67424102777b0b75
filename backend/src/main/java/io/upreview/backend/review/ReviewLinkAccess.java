package io.upreview.backend.review;

import io.upreview.backend.exception.ReviewFlowException;
import io.upreview.backend.token.ReviewLinkTokenVerifier;
import io.upreview.backend.token.TokenVerification;
import io.upreview.backend.token.TokenVerification.Rejected;
import io.upreview.backend.token.TokenVerification.Verified;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Turns a token verification into an admission decision for the public endpoints. */
@Component
public class ReviewLinkAccess {

  private final ReviewLinkTokenVerifier verifier;

  public ReviewLinkAccess(ReviewLinkTokenVerifier verifier) {
    this.verifier = verifier;
  }

  /**
   * @throws ReviewFlowException INVALID_TOKEN for any verifier rejection
   */
  public Verified requireValid(String token, UUID businessId, String recipientId) {
    TokenVerification verification = verifier.verify(token, businessId, recipientId);
    if (verification instanceof Rejected rejected) {
      throw ReviewFlowException.invalidToken(rejected.reason());
    }
    return (Verified) verification;
  }
}
