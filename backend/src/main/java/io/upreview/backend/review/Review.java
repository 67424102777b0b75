package io.upreview.backend.review;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A review submitted through a review link. At most one per (business, recipient), enforced by a
 * unique constraint. Never modified by the public flow.
 */
@Entity
@Table(name = "reviews")
public class Review {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "business_id", nullable = false, updatable = false)
  private UUID businessId;

  @Column(name = "recipient_id", nullable = false, updatable = false)
  private UUID recipientId;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT", updatable = false)
  private String content;

  @Column(name = "stars", precision = 2, scale = 1, updatable = false)
  private BigDecimal stars;

  @Column(name = "happy", nullable = false, updatable = false)
  private boolean happy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Review() {}

  public Review(
      UUID businessId, UUID recipientId, String content, BigDecimal stars, boolean happy) {
    this.businessId = businessId;
    this.recipientId = recipientId;
    this.content = content;
    this.stars = stars;
    this.happy = happy;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getBusinessId() {
    return businessId;
  }

  public UUID getRecipientId() {
    return recipientId;
  }

  public String getContent() {
    return content;
  }

  public BigDecimal getStars() {
    return stars;
  }

  public boolean isHappy() {
    return happy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
