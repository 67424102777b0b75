package io.upreview.backend.invitation;

import io.upreview.backend.review.ReviewType;
import io.upreview.backend.token.ReviewLinkProperties;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Builds {@code {baseUrl}/submit-review/{recipientId}?type=..&businessId=..&token=..} links for the
 * public review page.
 */
@Component
public class ReviewLinkBuilder {

  private final String baseUrl;

  public ReviewLinkBuilder(ReviewLinkProperties properties) {
    this.baseUrl = properties.baseUrl();
  }

  public ReviewLinks build(UUID businessId, String recipientId, String token) {
    return new ReviewLinks(
        link(businessId, recipientId, token, ReviewType.GOOD),
        link(businessId, recipientId, token, ReviewType.BAD));
  }

  private String link(UUID businessId, String recipientId, String token, ReviewType type) {
    return UriComponentsBuilder.fromUriString(baseUrl)
        .pathSegment("submit-review", recipientId)
        .queryParam("type", type.wireValue())
        .queryParam("businessId", businessId)
        .queryParam("token", token)
        .encode()
        .build()
        .toUriString();
  }
}
