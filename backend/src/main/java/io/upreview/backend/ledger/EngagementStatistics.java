package io.upreview.backend.ledger;

/**
 * Invitation funnel for one business. Each count is of distinct recipients.
 *
 * @param consideredRecipients recipients that clicked after their latest invitation
 * @param averageSecondsToClick mean time from latest invitation to the first click after it; null
 *     when no recipient qualifies
 */
public record EngagementStatistics(
    long totalRecipients,
    long invitedRecipients,
    long clickedRecipients,
    long submittedRecipients,
    long consideredRecipients,
    Double averageSecondsToClick) {}
