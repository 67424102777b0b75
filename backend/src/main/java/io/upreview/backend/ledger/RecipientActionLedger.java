package io.upreview.backend.ledger;

import io.upreview.backend.exception.ReviewFlowError;
import io.upreview.backend.exception.ReviewFlowException;
import io.upreview.backend.recipient.RecipientRepository;
import io.upreview.backend.review.ReviewRepository;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Authoritative record of what a recipient has done for a business. Recipient state (invited,
 * clicked, submitted) is derived from the presence of events, never stored.
 */
@Service
public class RecipientActionLedger {

  private static final Logger log = LoggerFactory.getLogger(RecipientActionLedger.class);

  private final RecipientActionEventRepository eventRepository;
  private final RecipientRepository recipientRepository;
  private final ReviewRepository reviewRepository;

  public RecipientActionLedger(
      RecipientActionEventRepository eventRepository,
      RecipientRepository recipientRepository,
      ReviewRepository reviewRepository) {
    this.eventRepository = eventRepository;
    this.recipientRepository = recipientRepository;
    this.reviewRepository = reviewRepository;
  }

  @Transactional(readOnly = true)
  public boolean wasInvited(UUID businessId, UUID recipientId) {
    return eventRepository.existsByBusinessIdAndRecipientIdAndAction(
        businessId, recipientId, RecipientAction.INVITED);
  }

  @Transactional(readOnly = true)
  public boolean hasClicked(UUID businessId, UUID recipientId) {
    return eventRepository.existsByBusinessIdAndRecipientIdAndAction(
        businessId, recipientId, RecipientAction.CLICKED);
  }

  /** Checked against the reviews table so the ledger and the stored review cannot disagree. */
  @Transactional(readOnly = true)
  public boolean hasSubmitted(UUID businessId, UUID recipientId) {
    return reviewRepository.existsByBusinessIdAndRecipientId(businessId, recipientId);
  }

  /**
   * Appends one event. Flushes immediately so constraint violations surface inside the caller's
   * transaction.
   */
  @Transactional
  public RecipientActionEvent append(
      UUID businessId,
      UUID recipientId,
      RecipientAction action,
      String actorId,
      Map<String, Object> meta) {
    var event = new RecipientActionEvent(businessId, recipientId, actorId, action, meta);
    event = eventRepository.saveAndFlush(event);
    log.debug("Recorded {} for business={} recipient={}", action, businessId, recipientId);
    return event;
  }

  /** Records a confirmed invitation delivery. */
  @Transactional
  public RecipientActionEvent recordInvitation(
      UUID businessId, UUID recipientId, String actorId, Map<String, Object> meta) {
    return append(businessId, recipientId, RecipientAction.INVITED, actorId, meta);
  }

  /**
   * Records a public link click. Clicking again is allowed and reports {@code already=true}; a
   * second row is still written.
   *
   * <p>Two simultaneous first clicks may both report {@code already=false}. That race is accepted.
   *
   * @throws ReviewFlowException NOT_FOUND if the recipient does not belong to the business,
   *     EMAIL_NOT_SENT if no invitation was delivered, REVIEW_ALREADY_SUBMITTED after submission
   */
  @Transactional
  public ClickResult recordClick(UUID businessId, UUID recipientId, ClientContext client) {
    if (!recipientRepository.existsByIdAndBusinessId(recipientId, businessId)) {
      throw new ReviewFlowException(ReviewFlowError.NOT_FOUND);
    }
    if (!wasInvited(businessId, recipientId)) {
      throw new ReviewFlowException(ReviewFlowError.EMAIL_NOT_SENT);
    }
    if (hasSubmitted(businessId, recipientId)) {
      throw new ReviewFlowException(ReviewFlowError.REVIEW_ALREADY_SUBMITTED);
    }

    boolean already = hasClicked(businessId, recipientId);
    append(businessId, recipientId, RecipientAction.CLICKED, null, client.toMeta());

    log.info(
        "Review link clicked for business={} recipient={} already={}",
        businessId,
        recipientId,
        already);
    return new ClickResult(already);
  }
}
