package io.upreview.backend.ledger;

/**
 * Response to a recorded link click.
 *
 * @param already true when an earlier click had already been recorded for the recipient
 */
public record ClickResult(boolean already) {}
