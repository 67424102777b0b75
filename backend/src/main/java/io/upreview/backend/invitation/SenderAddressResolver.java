package io.upreview.backend.invitation;

import io.upreview.backend.business.Business;
import io.upreview.backend.integration.email.EmailProperties;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Picks the sender for a business: its own email unless that is a public mailbox, else a
 * slug-based address on the verified sending domain, else the configured fallback.
 */
@Component
public class SenderAddressResolver {

  static final String DEFAULT_SENDER_NAME = "Our Team";
  private static final List<String> PUBLIC_MAILBOX_DOMAINS =
      List.of("@gmail.com", "@yahoo.com", "@outlook.com", "@hotmail.com");
  private static final int MAX_LOCAL_PART_LENGTH = 64;

  private final EmailProperties emailProperties;

  public SenderAddressResolver(EmailProperties emailProperties) {
    this.emailProperties = emailProperties;
  }

  public SenderAddress resolve(Business business) {
    String name = business.getDisplayName();
    name = name == null || name.isBlank() ? DEFAULT_SENDER_NAME : name.trim();

    String businessEmail = business.getBusinessEmail() == null ? "" : business.getBusinessEmail();
    businessEmail = businessEmail.trim();
    if (!looksLikePublicMailbox(businessEmail)) {
      return new SenderAddress(name, businessEmail);
    }
    String localPart = senderLocalPart(business.getSlug());
    if (localPart != null) {
      return new SenderAddress(name, localPart + "@" + emailProperties.senderDomain());
    }
    return new SenderAddress(name, emailProperties.fallbackFromAddressOrDefault());
  }

  static boolean looksLikePublicMailbox(String address) {
    String lower = address.toLowerCase(Locale.ROOT);
    return lower.isEmpty() || PUBLIC_MAILBOX_DOMAINS.stream().anyMatch(lower::endsWith);
  }

  /** Lower-cased slug with runs of other characters collapsed to '-'; null if nothing remains. */
  static String senderLocalPart(String slug) {
    if (slug == null) {
      return null;
    }
    String cleaned =
        slug.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
    if (cleaned.length() > MAX_LOCAL_PART_LENGTH) {
      cleaned = cleaned.substring(0, MAX_LOCAL_PART_LENGTH);
    }
    return cleaned.isEmpty() ? null : cleaned;
  }
}
