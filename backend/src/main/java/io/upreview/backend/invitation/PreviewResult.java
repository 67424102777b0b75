package io.upreview.backend.invitation;

public record PreviewResult(String messageId, String from) {}
