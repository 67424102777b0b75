package io.upreview.backend.business;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-business invitation copy. {@code [customer]} in either field is replaced with the recipient's
 * display name.
 */
@Entity
@Table(name = "email_templates")
public class EmailTemplate {

  public static final String DEFAULT_SUBJECT = "Please leave us a review!";
  public static final String DEFAULT_BODY =
      "We would really appreciate if you left us a review. Please leave your feedback using the"
          + " buttons below.";

  @Id
  @Column(name = "business_id")
  private UUID businessId;

  @Column(name = "email_subject", length = 255)
  private String emailSubject;

  @Column(name = "email_body", columnDefinition = "TEXT")
  private String emailBody;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected EmailTemplate() {}

  public EmailTemplate(UUID businessId, String emailSubject, String emailBody) {
    this.businessId = businessId;
    this.emailSubject = emailSubject;
    this.emailBody = emailBody;
    this.updatedAt = Instant.now();
  }

  /** Template used when a business has not saved its own. */
  public static EmailTemplate defaults(UUID businessId) {
    return new EmailTemplate(businessId, DEFAULT_SUBJECT, DEFAULT_BODY);
  }

  public String subjectOrDefault() {
    return emailSubject == null || emailSubject.isBlank() ? DEFAULT_SUBJECT : emailSubject;
  }

  public String bodyOrDefault() {
    return emailBody == null || emailBody.isBlank() ? DEFAULT_BODY : emailBody;
  }

  public UUID getBusinessId() {
    return businessId;
  }

  public String getEmailSubject() {
    return emailSubject;
  }

  public String getEmailBody() {
    return emailBody;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
