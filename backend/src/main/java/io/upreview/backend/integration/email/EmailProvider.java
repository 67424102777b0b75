package io.upreview.backend.integration.email;

/**
 * Port for sending emails via an external provider. The active adapter is selected by {@code
 * upreview.email.provider}.
 */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "sendgrid", "noop"). */
  String providerId();

  /**
   * Send an email message. Delivery problems are reported in the result, not thrown. Callers still
   * guard against unexpected runtime exceptions.
   */
  SendResult sendEmail(EmailMessage message);
}
