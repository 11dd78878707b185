package axios.mail.sync.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * A locally requested mutation waiting to be applied on the provider.
 * Rows are kept after completion for audit.
 */
@Entity
@Table(name = "pending_operations", indexes = {
        @Index(name = "idx_pending_operations_account_status", columnList = "accountId, status"),
        @Index(name = "idx_pending_operations_message", columnList = "messageId")
})
@Data
public class PendingOperation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String accountId;

    private String messageId;

    // snapshots of the remote identity, the local row may be gone by the time we drain
    private String remoteId;

    @Column(length = 1000)
    private String internetMessageId;

    @Enumerated(EnumType.STRING)
    private OperationKind kind;

    @Enumerated(EnumType.STRING)
    private OperationStatus status = OperationStatus.PENDING;

    private int attempts;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    // completed by dedup without reaching the provider
    private boolean cancelled;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant completedAt;
}
