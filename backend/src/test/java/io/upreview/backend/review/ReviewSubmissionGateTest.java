package io.upreview.backend.review;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.upreview.backend.exception.ReviewFlowError;
import io.upreview.backend.exception.ReviewFlowException;
import io.upreview.backend.ledger.RecipientAction;
import io.upreview.backend.ledger.RecipientActionLedger;
import io.upreview.backend.recipient.Recipient;
import io.upreview.backend.recipient.RecipientRepository;
import io.upreview.backend.recipient.Sentiment;
import io.upreview.backend.token.PreviewRecipient;
import io.upreview.backend.token.TokenPayload;
import io.upreview.backend.token.TokenRejection;
import io.upreview.backend.token.TokenVerification.Verified;
import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class ReviewSubmissionGateTest {

  private static final UUID BUSINESS_ID = UUID.randomUUID();
  private static final UUID RECIPIENT_ID = UUID.randomUUID();
  private static final String TOKEN = "payload.signature";

  @Mock private ReviewLinkAccess reviewLinkAccess;
  @Mock private RecipientRepository recipientRepository;
  @Mock private ReviewRepository reviewRepository;
  @Mock private RecipientActionLedger ledger;

  private ReviewSubmissionGate gate;
  private Recipient recipient;

  @BeforeEach
  void setUp() {
    gate =
        new ReviewSubmissionGate(reviewLinkAccess, recipientRepository, reviewRepository, ledger);
    recipient = new Recipient(BUSINESS_ID, "Jo Citizen", "jo@example.com");
  }

  private void givenValidToken() {
    when(reviewLinkAccess.requireValid(TOKEN, BUSINESS_ID, RECIPIENT_ID.toString()))
        .thenReturn(
            new Verified(
                new TokenPayload(BUSINESS_ID.toString(), RECIPIENT_ID.toString(), Long.MAX_VALUE),
                false));
  }

  private void givenLockedRecipient() {
    when(recipientRepository.findByIdAndBusinessIdForUpdate(RECIPIENT_ID, BUSINESS_ID))
        .thenReturn(Optional.of(recipient));
  }

  private static ReviewSubmission good(String text, BigDecimal stars) {
    return new ReviewSubmission(ReviewType.GOOD, text, stars);
  }

  @Test
  void preview_submission_touches_no_storage() {
    when(reviewLinkAccess.requireValid("anything", BUSINESS_ID, PreviewRecipient.ID))
        .thenReturn(
            new Verified(
                new TokenPayload(BUSINESS_ID.toString(), PreviewRecipient.ID, Long.MAX_VALUE),
                true));

    SubmissionReceipt receipt =
        gate.submit("anything", BUSINESS_ID, PreviewRecipient.ID, good("Great", null));

    assertThat(receipt.preview()).isTrue();
    assertThat(receipt.mode()).isEqualTo("preview");
    verifyNoInteractions(recipientRepository, reviewRepository, ledger);
  }

  @Test
  void invalid_token_is_rejected_before_any_lookup() {
    when(reviewLinkAccess.requireValid(TOKEN, BUSINESS_ID, RECIPIENT_ID.toString()))
        .thenThrow(ReviewFlowException.invalidToken(TokenRejection.EXPIRED));

    assertThatThrownBy(
            () -> gate.submit(TOKEN, BUSINESS_ID, RECIPIENT_ID.toString(), good("Great", null)))
        .isInstanceOf(ReviewFlowException.class)
        .extracting(e -> ((ReviewFlowException) e).getError())
        .isEqualTo(ReviewFlowError.INVALID_TOKEN);
    verifyNoInteractions(recipientRepository, reviewRepository, ledger);
  }

  @Test
  void unknown_recipient_is_not_found() {
    givenValidToken();
    when(recipientRepository.findByIdAndBusinessIdForUpdate(RECIPIENT_ID, BUSINESS_ID))
        .thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> gate.submit(TOKEN, BUSINESS_ID, RECIPIENT_ID.toString(), good("Great", null)))
        .extracting(e -> ((ReviewFlowException) e).getError())
        .isEqualTo(ReviewFlowError.NOT_FOUND);
  }

  @Test
  void second_submission_is_rejected() {
    givenValidToken();
    givenLockedRecipient();
    when(ledger.hasSubmitted(BUSINESS_ID, RECIPIENT_ID)).thenReturn(true);

    assertThatThrownBy(
            () -> gate.submit(TOKEN, BUSINESS_ID, RECIPIENT_ID.toString(), good("Again", null)))
        .extracting(e -> ((ReviewFlowException) e).getError())
        .isEqualTo(ReviewFlowError.REVIEW_ALREADY_SUBMITTED);
    verify(reviewRepository, never()).saveAndFlush(any());
    verify(ledger, never()).append(any(), any(), any(), any(), anyMap());
  }

  @Test
  void stores_review_sets_sentiment_and_appends_submitted() {
    givenValidToken();
    givenLockedRecipient();

    SubmissionReceipt receipt =
        gate.submit(
            TOKEN,
            BUSINESS_ID,
            RECIPIENT_ID.toString(),
            good("  Friendly and quick  ", new BigDecimal("4.5")));

    assertThat(receipt.preview()).isFalse();
    assertThat(receipt.mode()).isEqualTo("stored");

    var reviewCaptor = ArgumentCaptor.forClass(Review.class);
    verify(reviewRepository).saveAndFlush(reviewCaptor.capture());
    Review review = reviewCaptor.getValue();
    assertThat(review.getContent()).isEqualTo("Friendly and quick");
    assertThat(review.getStars()).isEqualByComparingTo("4.5");
    assertThat(review.isHappy()).isTrue();
    assertThat(recipient.getSentiment()).isEqualTo(Sentiment.GOOD);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, Object>> metaCaptor = ArgumentCaptor.forClass(Map.class);
    verify(ledger)
        .append(
            eq(BUSINESS_ID),
            eq(RECIPIENT_ID),
            eq(RecipientAction.SUBMITTED),
            isNull(),
            metaCaptor.capture());
    assertThat(metaCaptor.getValue()).containsEntry("happy", true);
    assertThat((BigDecimal) metaCaptor.getValue().get("stars")).isEqualByComparingTo("4.5");
  }

  @Test
  void bad_review_marks_recipient_unhappy_and_drops_out_of_range_stars() {
    givenValidToken();
    givenLockedRecipient();

    gate.submit(
        TOKEN,
        BUSINESS_ID,
        RECIPIENT_ID.toString(),
        new ReviewSubmission(ReviewType.BAD, "Late", new BigDecimal("7")));

    var reviewCaptor = ArgumentCaptor.forClass(Review.class);
    verify(reviewRepository).saveAndFlush(reviewCaptor.capture());
    assertThat(reviewCaptor.getValue().isHappy()).isFalse();
    assertThat(reviewCaptor.getValue().getStars()).isNull();
    assertThat(recipient.getSentiment()).isEqualTo(Sentiment.BAD);
  }

  @Test
  void concurrent_duplicate_from_unique_constraint_becomes_already_submitted() {
    givenValidToken();
    givenLockedRecipient();
    when(reviewRepository.saveAndFlush(any(Review.class)))
        .thenThrow(
            new DataIntegrityViolationException(
                "duplicate key", new SQLException("duplicate key value", "23505")));

    assertThatThrownBy(
            () -> gate.submit(TOKEN, BUSINESS_ID, RECIPIENT_ID.toString(), good("Great", null)))
        .extracting(e -> ((ReviewFlowException) e).getError())
        .isEqualTo(ReviewFlowError.REVIEW_ALREADY_SUBMITTED);
  }

  @Test
  void other_integrity_violations_propagate() {
    givenValidToken();
    givenLockedRecipient();
    var failure =
        new DataIntegrityViolationException(
            "check violation", new SQLException("value out of range", "23514"));
    when(reviewRepository.saveAndFlush(any(Review.class))).thenThrow(failure);

    assertThatThrownBy(
            () -> gate.submit(TOKEN, BUSINESS_ID, RECIPIENT_ID.toString(), good("Great", null)))
        .isSameAs(failure);
  }

  @Test
  void isUniqueViolation_walks_the_cause_chain() {
    var nested =
        new DataIntegrityViolationException(
            "outer", new RuntimeException("wrapper", new SQLException("dup", "23505")));

    assertThat(ReviewSubmissionGate.isUniqueViolation(nested)).isTrue();
    assertThat(ReviewSubmissionGate.isUniqueViolation(new RuntimeException("plain"))).isFalse();
  }
}
