package io.upreview.backend.review;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.math.BigDecimal;
import java.util.UUID;

public record SubmitReviewRequest(
    @NotNull UUID businessId,
    @NotNull @Pattern(regexp = ReviewLinkRequest.RECIPIENT_ID_PATTERN) String recipientId,
    String token,
    @NotNull ReviewType type,
    @NotBlank String review,
    BigDecimal stars) {

  ReviewSubmission toSubmission() {
    return new ReviewSubmission(type, review, stars);
  }
}
