package io.upreview.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure codes of the review link flow. The name is returned to callers in the {@code error}
 * property of the problem body.
 */
public enum ReviewFlowError {
  INVALID_TOKEN(
      HttpStatus.FORBIDDEN,
      "Invalid review link",
      "This review link didn't work. Please use the link from your most recent email."),
  EMAIL_NOT_SENT(
      HttpStatus.FORBIDDEN,
      "Review link not active",
      "This review link is not active for you (no invite email recorded)."),
  REVIEW_ALREADY_SUBMITTED(
      HttpStatus.CONFLICT,
      "Review already submitted",
      "You've already submitted a review for this visit."),
  NOT_FOUND(HttpStatus.NOT_FOUND, "Not found", "Recipient not found for this business."),
  ACCESS_DENIED(
      HttpStatus.FORBIDDEN, "Access denied", "You do not have access to this business."),
  DELIVERY_FAILED(HttpStatus.BAD_GATEWAY, "Delivery failed", "The email could not be sent.");

  private final HttpStatus status;
  private final String title;
  private final String defaultDetail;

  ReviewFlowError(HttpStatus status, String title, String defaultDetail) {
    this.status = status;
    this.title = title;
    this.defaultDetail = defaultDetail;
  }

  public HttpStatus status() {
    return status;
  }

  public String title() {
    return title;
  }

  public String defaultDetail() {
    return defaultDetail;
  }
}
