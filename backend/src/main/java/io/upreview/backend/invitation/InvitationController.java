package io.upreview.backend.invitation;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/businesses/{businessId}/invitations")
public class InvitationController {

  private final InvitationDispatcher invitationDispatcher;

  public InvitationController(InvitationDispatcher invitationDispatcher) {
    this.invitationDispatcher = invitationDispatcher;
  }

  @PostMapping
  public ResponseEntity<DispatchReport> dispatch(
      @PathVariable UUID businessId, @Valid @RequestBody DispatchRequest request) {
    return ResponseEntity.ok(
        invitationDispatcher.dispatchBatch(businessId, request.recipientIds()));
  }

  @PostMapping("/preview")
  public ResponseEntity<PreviewResult> preview(
      @PathVariable UUID businessId, @Valid @RequestBody PreviewRequest request) {
    return ResponseEntity.ok(invitationDispatcher.sendPreview(businessId, request.toEmail()));
  }

  public record DispatchRequest(@NotEmpty List<@NotNull UUID> recipientIds) {}

  public record PreviewRequest(@NotBlank @Email String toEmail) {}
}
