package io.upreview.backend.review;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReviewRepository extends JpaRepository<Review, UUID> {

  boolean existsByBusinessIdAndRecipientId(UUID businessId, UUID recipientId);

  long countByBusinessIdAndRecipientId(UUID businessId, UUID recipientId);
}
