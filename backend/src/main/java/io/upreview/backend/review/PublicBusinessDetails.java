package io.upreview.backend.review;

import io.upreview.backend.business.Business;
import java.util.UUID;

/** Business profile shown on the public review page. */
public record PublicBusinessDetails(
    UUID id, String slug, String displayName, String description, String googleReviewLink) {

  static PublicBusinessDetails from(Business business) {
    return new PublicBusinessDetails(
        business.getId(),
        business.getSlug(),
        business.getDisplayName(),
        business.getDescription(),
        business.getGoogleReviewLink());
  }
}
