package io.upreview.backend.review;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.UUID;

/** Identifies a review link: the pair it claims to be scoped to plus the token. */
public record ReviewLinkRequest(
    @NotNull UUID businessId,
    @NotNull @Pattern(regexp = ReviewLinkRequest.RECIPIENT_ID_PATTERN) String recipientId,
    String token) {

  static final String RECIPIENT_ID_PATTERN =
      "^(test|[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})$";
}
