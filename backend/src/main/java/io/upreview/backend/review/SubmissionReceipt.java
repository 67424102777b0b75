package io.upreview.backend.review;

/**
 * Successful submission.
 *
 * @param preview true when the submission came from a preview link and nothing was stored
 */
public record SubmissionReceipt(boolean preview) {

  public static SubmissionReceipt stored() {
    return new SubmissionReceipt(false);
  }

  public static SubmissionReceipt previewOnly() {
    return new SubmissionReceipt(true);
  }

  public String mode() {
    return preview ? "preview" : "stored";
  }
}
