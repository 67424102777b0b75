package io.upreview.backend.recipient;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A customer of a business who can be invited to leave a review. */
@Entity
@Table(name = "recipients")
public class Recipient {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "business_id", nullable = false)
  private UUID businessId;

  @Column(name = "display_name", length = 255)
  private String displayName;

  @Column(name = "email", length = 255)
  private String email;

  @Enumerated(EnumType.STRING)
  @Column(name = "sentiment", nullable = false, length = 20)
  private Sentiment sentiment;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Recipient() {}

  public Recipient(UUID businessId, String displayName, String email) {
    this.businessId = businessId;
    this.displayName = displayName;
    this.email = email;
    this.sentiment = Sentiment.UNREVIEWED;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Records the sentiment of the recipient's submitted review. */
  public void markReviewed(boolean happy) {
    this.sentiment = happy ? Sentiment.GOOD : Sentiment.BAD;
    this.updatedAt = Instant.now();
  }

  public boolean hasEmail() {
    return email != null && !email.isBlank();
  }

  public UUID getId() {
    return id;
  }

  public UUID getBusinessId() {
    return businessId;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getEmail() {
    return email;
  }

  public Sentiment getSentiment() {
    return sentiment;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
