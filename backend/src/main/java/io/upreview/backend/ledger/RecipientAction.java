package io.upreview.backend.ledger;

/**
 * Closed set of recipient actions. Adding a value requires a migration of the {@code
 * recipient_actions.action} check constraint.
 */
public enum RecipientAction {
  INVITED,
  CLICKED,
  SUBMITTED
}
