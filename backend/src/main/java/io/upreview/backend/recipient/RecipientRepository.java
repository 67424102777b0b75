package io.upreview.backend.recipient;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RecipientRepository extends JpaRepository<Recipient, UUID> {

  boolean existsByIdAndBusinessId(UUID id, UUID businessId);

  /** Locks the recipient row so concurrent submissions for the same recipient serialize. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT r FROM Recipient r WHERE r.id = :id AND r.businessId = :businessId")
  Optional<Recipient> findByIdAndBusinessIdForUpdate(
      @Param("id") UUID id, @Param("businessId") UUID businessId);

  List<Recipient> findByBusinessIdAndIdIn(UUID businessId, Collection<UUID> ids);
}
