package io.upreview.backend.token;

/**
 * Reserved recipient id used by template previews. Links for this recipient always verify and never
 * touch storage.
 */
public final class PreviewRecipient {

  public static final String ID = "test";

  private PreviewRecipient() {}

  public static boolean matches(String recipientId) {
    return ID.equals(recipientId);
  }
}
