package io.upreview.backend.integration.email;

import java.util.Map;
import java.util.Objects;

/**
 * Provider-agnostic email payload. Contains the sender, recipient, subject, body (HTML and plain
 * text), and optional metadata for tracking.
 */
public record EmailMessage(
    String fromName,
    String fromAddress,
    String to,
    String subject,
    String htmlBody,
    String plainTextBody,
    Map<String, String> metadata) {

  public EmailMessage {
    Objects.requireNonNull(fromAddress, "fromAddress");
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /** RFC 5322 style header value, e.g. {@code "Acme Plumbing" <acme@example.com>}. */
  public String fromHeader() {
    if (fromName == null || fromName.isBlank()) {
      return fromAddress;
    }
    return "\"" + fromName.replace("\"", "") + "\" <" + fromAddress + ">";
  }

  void requireBody() {
    if (htmlBody == null && plainTextBody == null) {
      throw new IllegalArgumentException(
          "Email must have at least one of htmlBody or plainTextBody");
    }
  }
}
