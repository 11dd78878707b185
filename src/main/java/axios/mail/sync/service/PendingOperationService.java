package axios.mail.sync.service;

import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.MailMessage;
import axios.mail.sync.entity.OperationKind;
import axios.mail.sync.entity.OperationStatus;
import axios.mail.sync.entity.PendingOperation;
import axios.mail.sync.provider.MailProvider;
import axios.mail.sync.provider.MessageRef;
import axios.mail.sync.provider.ProviderException;
import axios.mail.sync.provider.RemoteNotFoundException;
import axios.mail.sync.provider.TransientProviderException;
import axios.mail.sync.repository.MailMessageRepository;
import axios.mail.sync.repository.PendingOperationRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable queue of local mutations waiting for the provider.
 * <p>
 * User actions update the cached message and insert the operation in one transaction and return
 * without touching the network. The sync cycle drains the queue before fetching, so remote state
 * fetched afterwards already reflects the user's changes.
 */
@Slf4j
@Service
public class PendingOperationService {
    private final PendingOperationRepository pendingOperationRepository;
    private final MailMessageRepository mailMessageRepository;
    private final OperationReducer operationReducer;

    @Value("${mailsync.queue.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${mailsync.queue.max-ops-per-drain:100}")
    private int maxOpsPerDrain = 100;

    @Value("${mailsync.queue.completed-retention-hours:0}")
    private long completedRetentionHours = 0;

    public PendingOperationService(PendingOperationRepository pendingOperationRepository,
                                   MailMessageRepository mailMessageRepository,
                                   OperationReducer operationReducer) {
        this.pendingOperationRepository = pendingOperationRepository;
        this.mailMessageRepository = mailMessageRepository;
        this.operationReducer = operationReducer;
    }

    /**
     * Applies a mutation to the cached message and queues it for the provider.
     * @param messageId Local message id
     * @param kind Mutation requested by the user
     * @return The queued operation
     * @throws EntityNotFoundException if the message does not exist
     * @throws IllegalStateException if the message is already being deleted
     */
    @Transactional
    public PendingOperation requestMutation(String messageId, OperationKind kind) {
        MailMessage message = mailMessageRepository.findById(messageId)
                .orElseThrow(() -> new EntityNotFoundException("Message not found: " + messageId));
        if (message.getFolder() == Folder.DELETING) {
            throw new IllegalStateException("Message " + messageId + " is being deleted");
        }

        applyLocally(message, kind);
        mailMessageRepository.save(message);

        PendingOperation operation = enqueue(message, kind);
        log.info("Queued {} for message {} (account {})", kind.getWireName(), messageId, message.getAccountId());
        return operation;
    }

    /**
     * Moves every trashed message of the account to {@link Folder#DELETING} and queues a permanent delete for each.
     */
    @Transactional
    public ClearTrashResult clearTrash(String accountId) {
        List<MailMessage> trashed = mailMessageRepository.findByAccountIdAndFolder(accountId, Folder.TRASH);
        int queued = 0;
        for (MailMessage message : trashed) {
            message.setFolder(Folder.DELETING);
            mailMessageRepository.save(message);
            enqueue(message, OperationKind.PERMANENT_DELETE);
            queued++;
        }
        log.info("Cleared trash of account {}: {} messages queued for permanent deletion", accountId, queued);
        return new ClearTrashResult(trashed.size(), queued);
    }

    private void applyLocally(MailMessage message, OperationKind kind) {
        switch (kind) {
            case MARK_READ:
                message.setRead(true);
                break;
            case MARK_UNREAD:
                message.setRead(false);
                break;
            case TRASH:
                if (message.getFolder() != Folder.TRASH) {
                    message.setOriginalFolder(message.getFolder());
                    message.setFolder(Folder.TRASH);
                }
                break;
            case RESTORE:
                if (message.getFolder() == Folder.TRASH) {
                    message.setFolder(message.getOriginalFolder() != null ? message.getOriginalFolder() : Folder.INBOX);
                    message.setOriginalFolder(null);
                }
                break;
            case DELETE:
            case PERMANENT_DELETE:
                message.setFolder(Folder.DELETING);
                break;
            default:
                throw new IllegalArgumentException("Unsupported operation: " + kind);
        }
    }

    private PendingOperation enqueue(MailMessage message, OperationKind kind) {
        Instant now = Instant.now();
        PendingOperation operation = new PendingOperation();
        operation.setAccountId(message.getAccountId());
        operation.setMessageId(message.getId());
        operation.setRemoteId(message.getRemoteId());
        operation.setInternetMessageId(message.getInternetMessageId());
        operation.setKind(kind);
        operation.setStatus(OperationStatus.PENDING);
        operation.setCreatedAt(now);
        operation.setUpdatedAt(now);
        return pendingOperationRepository.save(operation);
    }

    /**
     * Sends the pending operations of an account to its provider.
     * <p>
     * Operations are reduced per message first, cancelled ones complete without a remote call.
     * Each survivor gets one attempt per drain.
     * @throws ProviderException only for account level failures (credentials), which abort the drain
     */
    public DrainResult drain(MailAccount account, MailProvider provider) throws ProviderException {
        DrainResult result = new DrainResult();
        List<PendingOperation> pending = pendingOperationRepository
                .findByAccountIdAndStatusOrderByCreatedAtAscIdAsc(account.getId(), OperationStatus.PENDING);
        if (pending.isEmpty()) {
            return result;
        }

        OperationReducer.Reduction reduction = operationReducer.reduce(pending);
        for (PendingOperation operation : reduction.getCancelled()) {
            operation.setCancelled(true);
            markCompleted(operation);
            result.setCancelled(result.getCancelled() + 1);
        }
        if (!reduction.getCancelled().isEmpty()) {
            log.debug("Cancelled {} redundant operations for account {}", reduction.getCancelled().size(), account.getEmailAddress());
        }

        List<PendingOperation> toExecute = reduction.getToExecute();
        if (toExecute.size() > maxOpsPerDrain) {
            result.setDeferred(toExecute.size() - maxOpsPerDrain);
            toExecute = new ArrayList<>(toExecute.subList(0, maxOpsPerDrain));
        }

        for (PendingOperation operation : toExecute) {
            execute(operation, provider, result);
        }

        log.info("Drained queue for account {}: {} completed, {} cancelled, {} retrying, {} failed, {} deferred",
                account.getEmailAddress(), result.getCompleted(), result.getCancelled(),
                result.getRetrying(), result.getFailed(), result.getDeferred());
        return result;
    }

    private void execute(PendingOperation operation, MailProvider provider, DrainResult result) throws ProviderException {
        OperationKind kind = operation.getKind();
        try {
            provider.applyMutation(MessageRef.of(operation), kind);
            markCompleted(operation);
            result.setCompleted(result.getCompleted() + 1);
        } catch (RemoteNotFoundException e) {
            if (kind.isDeletion()) {
                log.debug("Message {} already gone remotely, {} treated as done", operation.getMessageId(), kind.getWireName());
                markCompleted(operation);
                result.setCompleted(result.getCompleted() + 1);
            } else {
                // retrying cannot make the message reappear
                markFailed(operation, e.getMessage());
                result.setFailed(result.getFailed() + 1);
                return;
            }
        } catch (TransientProviderException e) {
            recordTransientFailure(operation, e.getMessage(), result);
            return;
        }

        if (kind.isDeletion()) {
            removeDeletedMessage(operation.getMessageId());
        }
    }

    private void recordTransientFailure(PendingOperation operation, String error, DrainResult result) {
        operation.setAttempts(operation.getAttempts() + 1);
        operation.setLastError(error);
        operation.setUpdatedAt(Instant.now());
        if (operation.getAttempts() >= maxAttempts) {
            operation.setStatus(OperationStatus.FAILED);
            result.setFailed(result.getFailed() + 1);
            log.warn("Operation {} ({} on message {}) failed after {} attempts: {}", operation.getId(),
                    operation.getKind().getWireName(), operation.getMessageId(), operation.getAttempts(), error);
        } else {
            result.setRetrying(result.getRetrying() + 1);
            log.info("Operation {} attempt {} failed, will retry next cycle: {}", operation.getId(), operation.getAttempts(), error);
        }
        pendingOperationRepository.save(operation);
    }

    private void markCompleted(PendingOperation operation) {
        Instant now = Instant.now();
        operation.setStatus(OperationStatus.COMPLETED);
        operation.setCompletedAt(now);
        operation.setUpdatedAt(now);
        pendingOperationRepository.save(operation);
    }

    private void markFailed(PendingOperation operation, String error) {
        operation.setAttempts(operation.getAttempts() + 1);
        operation.setStatus(OperationStatus.FAILED);
        operation.setLastError(error);
        operation.setUpdatedAt(Instant.now());
        pendingOperationRepository.save(operation);
        log.warn("Operation {} ({} on message {}) failed: {}", operation.getId(),
                operation.getKind().getWireName(), operation.getMessageId(), error);
    }

    private void removeDeletedMessage(String messageId) {
        mailMessageRepository.findById(messageId).ifPresent(message -> {
            if (message.getFolder() == Folder.DELETING) {
                mailMessageRepository.delete(message);
                log.debug("Removed deleted message {} from local store", messageId);
            }
        });
    }

    /**
     * Re-opens a failed operation. Its attempt counter starts over.
     * @throws EntityNotFoundException if the operation does not exist
     * @throws IllegalStateException if the operation is not in the failed state
     */
    @Transactional
    public PendingOperation retryFailed(Long operationId) {
        PendingOperation operation = pendingOperationRepository.findById(operationId)
                .orElseThrow(() -> new EntityNotFoundException("Operation not found: " + operationId));
        if (operation.getStatus() != OperationStatus.FAILED) {
            throw new IllegalStateException("Operation " + operationId + " is " + operation.getStatus() + ", only failed operations can be retried");
        }
        operation.setStatus(OperationStatus.PENDING);
        operation.setAttempts(0);
        operation.setLastError(null);
        operation.setUpdatedAt(Instant.now());
        log.info("Operation {} re-queued for retry", operationId);
        return pendingOperationRepository.save(operation);
    }

    public List<PendingOperation> listOperations(String accountId, OperationStatus status) {
        if (accountId != null && status != null) {
            return pendingOperationRepository.findByAccountIdAndStatusOrderByCreatedAtDesc(accountId, status);
        }
        if (accountId != null) {
            return pendingOperationRepository.findByAccountIdOrderByCreatedAtDesc(accountId);
        }
        if (status != null) {
            return pendingOperationRepository.findByStatusOrderByCreatedAtDesc(status);
        }
        return pendingOperationRepository.findAll();
    }

    public boolean hasPendingOperation(String messageId) {
        return pendingOperationRepository.existsByMessageIdAndStatus(messageId, OperationStatus.PENDING);
    }

    @Scheduled(fixedDelayString = "${mailsync.queue.prune-interval-ms:3600000}")
    @Transactional
    public void pruneCompleted() {
        if (completedRetentionHours <= 0) {
            return;
        }
        Instant before = Instant.now().minus(Duration.ofHours(completedRetentionHours));
        int deleted = pendingOperationRepository.deleteByStatusAndCompletedAtBefore(OperationStatus.COMPLETED, before);
        if (deleted > 0) {
            log.info("Pruned {} completed operations older than {} hours", deleted, completedRetentionHours);
        }
    }
}
