package io.upreview.backend.review;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Review content posted from the review page.
 *
 * @param type good or bad, from the button the recipient pressed
 * @param review free text, required
 * @param stars optional rating; values outside 0 to 5 are dropped
 */
public record ReviewSubmission(
    @NotNull ReviewType type, @NotBlank String review, BigDecimal stars) {

  private static final BigDecimal MAX_STARS = BigDecimal.valueOf(5);

  public String trimmedReview() {
    return review == null ? "" : review.trim();
  }

  /** Stars at one decimal place, or null when absent or out of range. */
  public BigDecimal normalizedStars() {
    if (stars == null || stars.signum() < 0 || stars.compareTo(MAX_STARS) > 0) {
      return null;
    }
    return stars.setScale(1, RoundingMode.HALF_UP);
  }
}
