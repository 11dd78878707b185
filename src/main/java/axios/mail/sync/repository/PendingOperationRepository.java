package axios.mail.sync.repository;

import axios.mail.sync.entity.OperationStatus;
import axios.mail.sync.entity.PendingOperation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface PendingOperationRepository extends JpaRepository<PendingOperation, Long> {
    List<PendingOperation> findByAccountIdAndStatusOrderByCreatedAtAscIdAsc(String accountId, OperationStatus status);

    List<PendingOperation> findByAccountIdOrderByCreatedAtDesc(String accountId);

    List<PendingOperation> findByAccountIdAndStatusOrderByCreatedAtDesc(String accountId, OperationStatus status);

    List<PendingOperation> findByStatusOrderByCreatedAtDesc(OperationStatus status);

    boolean existsByMessageIdAndStatus(String messageId, OperationStatus status);

    @Modifying
    @Query("DELETE FROM PendingOperation p WHERE p.status = :status AND p.completedAt < :before")
    int deleteByStatusAndCompletedAtBefore(@Param("status") OperationStatus status, @Param("before") Instant before);
}
