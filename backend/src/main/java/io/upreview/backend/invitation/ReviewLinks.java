package io.upreview.backend.invitation;

/** The two links placed in an invitation email. */
public record ReviewLinks(String goodHref, String badHref) {}
