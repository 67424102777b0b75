package io.upreview.backend.token;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for signed review links.
 *
 * @param secret HMAC key used to mint and verify tokens; required at startup
 * @param previousSecret optional key still accepted for verification while rotating secrets
 * @param ttl lifetime of a minted token
 * @param baseUrl public origin of the review page the links point to
 * @param dispatchConcurrency number of invitation sends in flight at once
 */
@Validated
@ConfigurationProperties(prefix = "upreview.review-links")
public record ReviewLinkProperties(
    @NotBlank String secret,
    String previousSecret,
    @DefaultValue("7d") Duration ttl,
    @DefaultValue("http://localhost:3000") String baseUrl,
    @DefaultValue("5") @Min(1) int dispatchConcurrency) {}
