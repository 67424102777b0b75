package io.upreview.backend.invitation;

import java.util.List;
import java.util.UUID;

/**
 * Per-recipient outcome of a batch, each list in request order.
 *
 * @param missing requested ids that do not belong to the business
 * @param from the {@code From} header used for every message
 */
public record DispatchReport(
    List<Sent> sent, List<Failed> failed, List<UUID> missing, String from) {

  /** Result of delivering to one recipient. */
  public sealed interface Outcome permits Sent, Failed {}

  public record Sent(UUID recipientId, String email) implements Outcome {}

  public record Failed(UUID recipientId, String reason) implements Outcome {}
}
