package io.upreview.backend.token;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Signed body of a review link. The property order is fixed so that the serialized bytes, and
 * therefore the MAC, are deterministic.
 *
 * @param businessId tenant the link is scoped to
 * @param recipientId recipient the link is scoped to, or {@link PreviewRecipient#ID}
 * @param expiresAt absolute expiry in epoch milliseconds
 */
@JsonPropertyOrder({"businessId", "recipientId", "expiresAt"})
public record TokenPayload(String businessId, String recipientId, Long expiresAt) {}
