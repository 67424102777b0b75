package io.upreview.backend.integration.email;

/** Outcome of a single send. {@code providerMessageId} is set only on success. */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
