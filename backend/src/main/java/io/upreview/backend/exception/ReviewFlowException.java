package io.upreview.backend.exception;

import io.upreview.backend.token.TokenRejection;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a review link operation cannot proceed. Token rejections are collapsed into {@link
 * ReviewFlowError#INVALID_TOKEN}; the precise {@link TokenRejection} stays server-side.
 */
public class ReviewFlowException extends ErrorResponseException {

  private final ReviewFlowError error;
  private final TokenRejection rejection;

  public ReviewFlowException(ReviewFlowError error) {
    this(error, error.defaultDetail(), null);
  }

  public ReviewFlowException(ReviewFlowError error, String detail) {
    this(error, detail, null);
  }

  private ReviewFlowException(ReviewFlowError error, String detail, TokenRejection rejection) {
    super(error.status(), createProblem(error, detail), null);
    this.error = error;
    this.rejection = rejection;
  }

  public static ReviewFlowException invalidToken(TokenRejection rejection) {
    return new ReviewFlowException(
        ReviewFlowError.INVALID_TOKEN, ReviewFlowError.INVALID_TOKEN.defaultDetail(), rejection);
  }

  public ReviewFlowError getError() {
    return error;
  }

  /** The verifier's reason, only set for {@link ReviewFlowError#INVALID_TOKEN}. */
  public TokenRejection getRejection() {
    return rejection;
  }

  private static ProblemDetail createProblem(ReviewFlowError error, String detail) {
    var problem = ProblemDetail.forStatus(error.status());
    problem.setTitle(error.title());
    problem.setDetail(detail);
    problem.setProperty("error", error.name());
    return problem;
  }
}
