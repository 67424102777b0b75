package io.upreview.backend.integration.email;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default email provider for local development and tests. Logs email details instead of sending
 * them.
 */
@Component
@ConditionalOnProperty(
    name = "upreview.email.provider",
    havingValue = "noop",
    matchIfMissing = true)
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    log.info(
        "NoOp email: would send from {} to {} with subject '{}'",
        message.fromHeader(),
        message.to(),
        message.subject());
    return new SendResult(true, "NOOP-" + UUID.randomUUID(), null);
  }
}
