package io.upreview.backend.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable ledger row. A null {@code actorId} means the public, unauthenticated recipient
 * performed the action.
 */
@Entity
@Table(name = "recipient_actions")
public class RecipientActionEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "business_id", nullable = false, updatable = false)
  private UUID businessId;

  @Column(name = "recipient_id", nullable = false, updatable = false)
  private UUID recipientId;

  @Column(name = "actor_id", length = 255, updatable = false)
  private String actorId;

  @Enumerated(EnumType.STRING)
  @Column(name = "action", nullable = false, length = 20, updatable = false)
  private RecipientAction action;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "meta", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> meta = new HashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected RecipientActionEvent() {}

  public RecipientActionEvent(
      UUID businessId,
      UUID recipientId,
      String actorId,
      RecipientAction action,
      Map<String, Object> meta) {
    this.businessId = businessId;
    this.recipientId = recipientId;
    this.actorId = actorId;
    this.action = action;
    this.meta = meta != null ? new HashMap<>(meta) : new HashMap<>();
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

  public String getActorId() {
    return actorId;
  }

  public RecipientAction getAction() {
    return action;
  }

  public Map<String, Object> getMeta() {
    return Collections.unmodifiableMap(meta);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
