package io.upreview.backend.invitation;

public record ComposedEmail(String subject, String htmlBody, String plainTextBody) {}
