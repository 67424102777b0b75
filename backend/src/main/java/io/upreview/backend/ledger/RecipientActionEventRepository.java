package io.upreview.backend.ledger;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RecipientActionEventRepository extends JpaRepository<RecipientActionEvent, UUID> {

  boolean existsByBusinessIdAndRecipientIdAndAction(
      UUID businessId, UUID recipientId, RecipientAction action);

  long countByBusinessIdAndRecipientIdAndAction(
      UUID businessId, UUID recipientId, RecipientAction action);
}
