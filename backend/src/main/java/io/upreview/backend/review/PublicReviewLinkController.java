package io.upreview.backend.review;

import io.upreview.backend.ledger.ClickResult;
import io.upreview.backend.ledger.ClientContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Public endpoints behind the links in invitation emails. Token-based access only. */
@RestController
@RequestMapping("/api/public/review-links")
public class PublicReviewLinkController {

  private final PublicReviewLinkService publicReviewLinkService;
  private final ReviewSubmissionGate reviewSubmissionGate;

  public PublicReviewLinkController(
      PublicReviewLinkService publicReviewLinkService,
      ReviewSubmissionGate reviewSubmissionGate) {
    this.publicReviewLinkService = publicReviewLinkService;
    this.reviewSubmissionGate = reviewSubmissionGate;
  }

  @PostMapping("/verify")
  public ResponseEntity<VerifyResponse> verify(@Valid @RequestBody ReviewLinkRequest request) {
    boolean preview =
        publicReviewLinkService.verify(
            request.token(), request.businessId(), request.recipientId());
    return ResponseEntity.ok(new VerifyResponse(true, preview));
  }

  @PostMapping("/business")
  public ResponseEntity<PublicBusinessDetails> getBusinessDetails(
      @Valid @RequestBody ReviewLinkRequest request) {
    return ResponseEntity.ok()
        .cacheControl(CacheControl.noStore())
        .body(
            publicReviewLinkService.getBusinessDetails(
                request.token(), request.businessId(), request.recipientId()));
  }

  @PostMapping("/clicks")
  public ResponseEntity<ClickResult> recordClick(
      @Valid @RequestBody ReviewLinkRequest request, HttpServletRequest httpRequest) {
    return ResponseEntity.ok(
        publicReviewLinkService.recordClick(
            request.token(),
            request.businessId(),
            request.recipientId(),
            ClientContext.from(httpRequest)));
  }

  @PostMapping("/submissions")
  public ResponseEntity<SubmitResponse> submit(@Valid @RequestBody SubmitReviewRequest request) {
    var receipt =
        reviewSubmissionGate.submit(
            request.token(), request.businessId(), request.recipientId(), request.toSubmission());
    return ResponseEntity.ok(new SubmitResponse(true, receipt.mode()));
  }

  public record VerifyResponse(boolean valid, boolean preview) {}

  public record SubmitResponse(boolean ok, String mode) {}
}
