package io.upreview.backend.integration.email;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Outbound email settings.
 *
 * @param provider {@code noop}, {@code smtp} or {@code sendgrid}
 * @param senderDomain verified sending domain used for slug-based sender addresses
 * @param fallbackFromAddress sender used when neither the business email nor its slug qualifies;
 *     defaults to {@code no-reply@senderDomain}
 * @param sendgridApiKey API key, required only for the {@code sendgrid} provider
 */
@Validated
@ConfigurationProperties("upreview.email")
public record EmailProperties(
    @DefaultValue("noop") String provider,
    @NotBlank @DefaultValue("reminders.upreview.com.au") String senderDomain,
    String fallbackFromAddress,
    String sendgridApiKey) {

  public String fallbackFromAddressOrDefault() {
    return fallbackFromAddress == null || fallbackFromAddress.isBlank()
        ? "no-reply@" + senderDomain
        : fallbackFromAddress;
  }
}
