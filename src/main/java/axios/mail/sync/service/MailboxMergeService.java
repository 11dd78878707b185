package axios.mail.sync.service;

import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.MailMessage;
import axios.mail.sync.entity.OperationStatus;
import axios.mail.sync.provider.RemoteMessage;
import axios.mail.sync.repository.MailMessageRepository;
import axios.mail.sync.repository.PendingOperationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Merges a fetched remote delta into the local mailbox store.
 * <p>
 * Read state and folder of a message with a pending operation are left alone, the queue
 * will make the provider agree with the local state. Tags are local only and never taken
 * from the remote snapshot.
 */
@Slf4j
@Service
public class MailboxMergeService {
    private final MailMessageRepository mailMessageRepository;
    private final PendingOperationRepository pendingOperationRepository;

    public MailboxMergeService(MailMessageRepository mailMessageRepository,
                               PendingOperationRepository pendingOperationRepository) {
        this.mailMessageRepository = mailMessageRepository;
        this.pendingOperationRepository = pendingOperationRepository;
    }

    public MergeResult merge(MailAccount account, List<RemoteMessage> remoteMessages) {
        MergeResult result = new MergeResult();
        for (RemoteMessage remote : remoteMessages) {
            try {
                mergeWithRetry(account.getId(), remote, result);
            } catch (DataAccessException | IllegalArgumentException e) {
                result.incrementFailures();
                log.warn("Failed to merge remote message {} for account {}: {}",
                        remote.getRemoteId(), account.getEmailAddress(), e.getMessage());
            }
        }
        log.info("Merged {} remote messages for account {}: {} new, {} updated, {} protected by pending operations",
                remoteMessages.size(), account.getEmailAddress(), result.getIngested().size(),
                result.getUpdated(), result.getProtectedByPending());
        return result;
    }

    /**
     * A user action or the classifier may have written the row since it was read. The merge is
     * then repeated once against a fresh copy so the newer local state (and any pending operation
     * it created) is honoured.
     */
    private void mergeWithRetry(String accountId, RemoteMessage remote, MergeResult result) {
        try {
            mergeOne(accountId, remote, result);
        } catch (OptimisticLockingFailureException e) {
            log.debug("Message {} changed locally while merging, retrying on a fresh copy", remote.getRemoteId());
            mergeOne(accountId, remote, result);
        }
    }

    private void mergeOne(String accountId, RemoteMessage remote, MergeResult result) {
        Optional<MailMessage> existing = mailMessageRepository.findByAccountIdAndRemoteId(accountId, remote.getRemoteId());
        if (existing.isEmpty() && remote.getInternetMessageId() != null) {
            existing = mailMessageRepository.findFirstByAccountIdAndInternetMessageId(accountId, remote.getInternetMessageId());
        }

        if (existing.isEmpty()) {
            MailMessage message = new MailMessage();
            message.setAccountId(accountId);
            copyContent(remote, message);
            message.setFolder(remote.getFolder() != null ? remote.getFolder() : Folder.INBOX);
            message.setRead(remote.isRead());
            message.setClassified(false);
            message.setIngestedAt(Instant.now());
            result.addIngested(mailMessageRepository.save(message));
            return;
        }

        MailMessage message = existing.get();
        if (message.getFolder() == Folder.DELETING) {
            // a queued delete will remove it, do not bring it back
            result.incrementProtected();
            return;
        }

        copyContent(remote, message);
        boolean pending = pendingOperationRepository.existsByMessageIdAndStatus(message.getId(), OperationStatus.PENDING);
        if (!pending) {
            message.setRead(remote.isRead());
            if (remote.getFolder() != null && remote.getFolder() != message.getFolder()) {
                if (remote.getFolder() == Folder.TRASH && message.getFolder() != Folder.TRASH) {
                    message.setOriginalFolder(message.getFolder());
                }
                message.setFolder(remote.getFolder());
            }
        }
        mailMessageRepository.save(message);
        if (pending) {
            result.incrementProtected();
        } else {
            result.incrementUpdated();
        }
    }

    private void copyContent(RemoteMessage remote, MailMessage message) {
        message.setRemoteId(remote.getRemoteId());
        if (remote.getInternetMessageId() != null) {
            message.setInternetMessageId(remote.getInternetMessageId());
        }
        message.setThreadId(remote.getThreadId());
        message.setFromAddress(remote.getFrom());
        message.setToAddresses(remote.getTo());
        message.setSubject(remote.getSubject());
        message.setSentAt(remote.getSentAt());
        message.setSnippet(remote.getSnippet());
        if (remote.getBodyText() != null) {
            message.setBodyText(remote.getBodyText());
        }
        if (remote.getBodyHtml() != null) {
            message.setBodyHtml(remote.getBodyHtml());
        }
    }
}
