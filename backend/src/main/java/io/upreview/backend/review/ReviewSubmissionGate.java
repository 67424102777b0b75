package io.upreview.backend.review;

import io.upreview.backend.exception.ReviewFlowError;
import io.upreview.backend.exception.ReviewFlowException;
import io.upreview.backend.ledger.RecipientAction;
import io.upreview.backend.ledger.RecipientActionLedger;
import io.upreview.backend.recipient.Recipient;
import io.upreview.backend.recipient.RecipientRepository;
import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admits at most one review per recipient. The review row, the recipient's sentiment and the
 * terminal {@code SUBMITTED} ledger event are written in a single transaction.
 */
@Service
public class ReviewSubmissionGate {

  private static final Logger log = LoggerFactory.getLogger(ReviewSubmissionGate.class);
  private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

  private final ReviewLinkAccess reviewLinkAccess;
  private final RecipientRepository recipientRepository;
  private final ReviewRepository reviewRepository;
  private final RecipientActionLedger ledger;

  public ReviewSubmissionGate(
      ReviewLinkAccess reviewLinkAccess,
      RecipientRepository recipientRepository,
      ReviewRepository reviewRepository,
      RecipientActionLedger ledger) {
    this.reviewLinkAccess = reviewLinkAccess;
    this.recipientRepository = recipientRepository;
    this.reviewRepository = reviewRepository;
    this.ledger = ledger;
  }

  /**
   * Stores a review for the recipient the token is scoped to. The token is always re-verified; a
   * verification from an earlier request is never trusted.
   *
   * @param token raw review link token
   * @param businessId business from the link
   * @param recipientId recipient from the link, or the preview sentinel
   * @param submission review content
   * @return receipt; preview links return without touching storage
   * @throws ReviewFlowException INVALID_TOKEN, NOT_FOUND or REVIEW_ALREADY_SUBMITTED
   */
  @Transactional
  public SubmissionReceipt submit(
      String token, UUID businessId, String recipientId, ReviewSubmission submission) {
    var verified = reviewLinkAccess.requireValid(token, businessId, recipientId);
    if (verified.preview()) {
      log.debug("Preview review submission for business={} not persisted", businessId);
      return SubmissionReceipt.previewOnly();
    }

    UUID recipientUuid = parseRecipientId(recipientId);
    Recipient recipient =
        recipientRepository
            .findByIdAndBusinessIdForUpdate(recipientUuid, businessId)
            .orElseThrow(() -> new ReviewFlowException(ReviewFlowError.NOT_FOUND));

    if (ledger.hasSubmitted(businessId, recipientUuid)) {
      throw new ReviewFlowException(ReviewFlowError.REVIEW_ALREADY_SUBMITTED);
    }

    boolean happy = submission.type().isHappy();
    BigDecimal stars = submission.normalizedStars();
    try {
      reviewRepository.saveAndFlush(
          new Review(businessId, recipientUuid, submission.trimmedReview(), stars, happy));

      recipient.markReviewed(happy);
      recipientRepository.save(recipient);

      Map<String, Object> meta = new HashMap<>();
      meta.put("stars", stars);
      meta.put("happy", happy);
      ledger.append(businessId, recipientUuid, RecipientAction.SUBMITTED, null, meta);
    } catch (DataIntegrityViolationException e) {
      if (isUniqueViolation(e)) {
        log.info(
            "Concurrent duplicate submission rejected for business={} recipient={}",
            businessId,
            recipientUuid);
        throw new ReviewFlowException(ReviewFlowError.REVIEW_ALREADY_SUBMITTED);
      }
      throw e;
    }

    log.info(
        "Review submitted for business={} recipient={} happy={}", businessId, recipientUuid, happy);
    return SubmissionReceipt.stored();
  }

  private static UUID parseRecipientId(String recipientId) {
    try {
      return UUID.fromString(recipientId);
    } catch (IllegalArgumentException e) {
      throw new ReviewFlowException(ReviewFlowError.NOT_FOUND);
    }
  }

  static boolean isUniqueViolation(Throwable ex) {
    for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
      if (cause instanceof SQLException sql
          && UNIQUE_VIOLATION_SQL_STATE.equals(sql.getSQLState())) {
        return true;
      }
      if (cause.getCause() == cause) {
        break;
      }
    }
    return false;
  }
}
