package io.upreview.backend.business;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A tenant that collects reviews. Owned by exactly one authenticated principal. */
@Entity
@Table(name = "businesses")
public class Business {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false, length = 255)
  private String ownerId;

  @Column(name = "slug", nullable = false, length = 100)
  private String slug;

  @Column(name = "display_name", nullable = false, length = 255)
  private String displayName;

  @Column(name = "business_email", length = 255)
  private String businessEmail;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "google_review_link", length = 1024)
  private String googleReviewLink;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Business() {}

  public Business(String ownerId, String slug, String displayName, String businessEmail) {
    this.ownerId = ownerId;
    this.slug = slug;
    this.displayName = displayName;
    this.businessEmail = businessEmail;
    this.createdAt = Instant.now();
  }

  public boolean isOwnedBy(String principalId) {
    return ownerId.equals(principalId);
  }

  public UUID getId() {
    return id;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public String getSlug() {
    return slug;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getBusinessEmail() {
    return businessEmail;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getGoogleReviewLink() {
    return googleReviewLink;
  }

  public void setGoogleReviewLink(String googleReviewLink) {
    this.googleReviewLink = googleReviewLink;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
