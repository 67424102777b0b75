package io.upreview.backend.review;

import io.upreview.backend.business.BusinessRepository;
import io.upreview.backend.exception.ReviewFlowError;
import io.upreview.backend.exception.ReviewFlowException;
import io.upreview.backend.ledger.ClickResult;
import io.upreview.backend.ledger.ClientContext;
import io.upreview.backend.ledger.RecipientActionLedger;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Token-gated operations available to unauthenticated holders of a review link. */
@Service
public class PublicReviewLinkService {

  private final ReviewLinkAccess reviewLinkAccess;
  private final RecipientActionLedger ledger;
  private final BusinessRepository businessRepository;

  public PublicReviewLinkService(
      ReviewLinkAccess reviewLinkAccess,
      RecipientActionLedger ledger,
      BusinessRepository businessRepository) {
    this.reviewLinkAccess = reviewLinkAccess;
    this.ledger = ledger;
    this.businessRepository = businessRepository;
  }

  /**
   * @return true when the link is a preview link
   * @throws ReviewFlowException INVALID_TOKEN
   */
  public boolean verify(String token, UUID businessId, String recipientId) {
    return reviewLinkAccess.requireValid(token, businessId, recipientId).preview();
  }

  /** Records a click. Preview links report a first click and write nothing. */
  public ClickResult recordClick(
      String token, UUID businessId, String recipientId, ClientContext client) {
    var verified = reviewLinkAccess.requireValid(token, businessId, recipientId);
    if (verified.preview()) {
      return new ClickResult(false);
    }
    return ledger.recordClick(businessId, UUID.fromString(recipientId), client);
  }

  @Transactional(readOnly = true)
  public PublicBusinessDetails getBusinessDetails(
      String token, UUID businessId, String recipientId) {
    reviewLinkAccess.requireValid(token, businessId, recipientId);
    return businessRepository
        .findById(businessId)
        .map(PublicBusinessDetails::from)
        .orElseThrow(
            () -> new ReviewFlowException(ReviewFlowError.NOT_FOUND, "Business not found."));
  }
}
