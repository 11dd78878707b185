package axios.mail.sync.service;

import axios.mail.sync.ai.ClassificationGate;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.MailMessage;
import axios.mail.sync.entity.SyncStatus;
import axios.mail.sync.notify.NotificationDispatcher;
import axios.mail.sync.provider.FetchResult;
import axios.mail.sync.provider.MailProvider;
import axios.mail.sync.provider.MailProviderFactory;
import axios.mail.sync.provider.ProviderAuthException;
import axios.mail.sync.provider.ProviderException;
import axios.mail.sync.repository.MailAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Drives the per-account sync cycle: drain queue, fetch remote, merge, classify, push labels, notify.
 * <p>
 * A trigger for an account whose cycle is still running is coalesced into a no-op; operations
 * queued meanwhile are drained by the next cycle. Between stages the account is reloaded and the
 * cycle stops if it was disabled or deleted.
 */
@Slf4j
@Service
public class SyncOrchestrator {
    private final MailAccountRepository mailAccountRepository;
    private final MailProviderFactory mailProviderFactory;
    private final PendingOperationService pendingOperationService;
    private final MailboxMergeService mailboxMergeService;
    private final ClassificationGate classificationGate;
    private final LabelSyncService labelSyncService;
    private final NotificationDispatcher notificationDispatcher;
    private final AccountSyncLockService accountSyncLockService;
    private final Executor syncExecutor;

    private final Map<String, SyncResult> lastResults = new ConcurrentHashMap<>();

    public SyncOrchestrator(MailAccountRepository mailAccountRepository,
                            MailProviderFactory mailProviderFactory,
                            PendingOperationService pendingOperationService,
                            MailboxMergeService mailboxMergeService,
                            ClassificationGate classificationGate,
                            LabelSyncService labelSyncService,
                            NotificationDispatcher notificationDispatcher,
                            AccountSyncLockService accountSyncLockService,
                            @Qualifier("syncExecutor") Executor syncExecutor) {
        this.mailAccountRepository = mailAccountRepository;
        this.mailProviderFactory = mailProviderFactory;
        this.pendingOperationService = pendingOperationService;
        this.mailboxMergeService = mailboxMergeService;
        this.classificationGate = classificationGate;
        this.labelSyncService = labelSyncService;
        this.notificationDispatcher = notificationDispatcher;
        this.accountSyncLockService = accountSyncLockService;
        this.syncExecutor = syncExecutor;
    }

    @Scheduled(fixedDelayString = "${mailsync.sync.interval-ms:300000}", initialDelayString = "${mailsync.sync.initial-delay-ms:10000}")
    public void syncAllAccounts() {
        List<MailAccount> accounts = mailAccountRepository.findByEnabledTrueAndSyncStatusNot(SyncStatus.EXPIRED);
        log.info("Scheduled sync started for {} accounts", accounts.size());
        for (MailAccount account : accounts) {
            requestSync(account.getId());
        }
    }

    /**
     * Starts a cycle for the account on the sync executor and returns immediately.
     * @return false if a cycle for the account is already in flight and the trigger was coalesced
     */
    public boolean requestSync(String accountId) {
        String nodeId = accountSyncLockService.getNodeId();
        if (!accountSyncLockService.tryLock(accountId, nodeId)) {
            log.debug("Sync for account {} already in progress, trigger coalesced", accountId);
            return false;
        }

        try {
            syncExecutor.execute(() -> {
                try {
                    runCycle(accountId);
                } finally {
                    accountSyncLockService.releaseLock(accountId, nodeId);
                }
            });
        } catch (TaskRejectedException e) {
            accountSyncLockService.releaseLock(accountId, nodeId);
            log.warn("Sync executor rejected cycle for account {}: {}", accountId, e.getMessage());
            return false;
        }
        return true;
    }

    /**
     * Runs one full cycle in the calling thread. Callers must hold the account sync lock.
     */
    SyncResult runCycle(String accountId) {
        SyncResult result = new SyncResult();
        result.setAccountId(accountId);
        result.setStartedAt(Instant.now());

        Optional<MailAccount> loaded = activeAccount(accountId);
        if (loaded.isEmpty()) {
            return finish(result, SyncOutcome.CANCELLED);
        }
        MailAccount account = loaded.get();
        result.setEmailAddress(account.getEmailAddress());
        log.info("Sync cycle started for account {}", account.getEmailAddress());

        try (MailProvider provider = mailProviderFactory.create(account)) {
            result.setStage(SyncStage.DRAIN_QUEUE);
            DrainResult drain = pendingOperationService.drain(account, provider);
            result.setOperationsCompleted(drain.getCompleted());
            result.setOperationsCancelled(drain.getCancelled());
            result.setOperationsFailed(drain.getFailed());
            if (activeAccount(accountId).isEmpty()) {
                return finish(result, SyncOutcome.CANCELLED);
            }

            result.setStage(SyncStage.FETCH_REMOTE);
            FetchResult fetch = provider.fetchChanges(account.getSyncCursor());
            result.setFetched(fetch.getMessages().size());
            Optional<MailAccount> current = activeAccount(accountId);
            if (current.isEmpty()) {
                return finish(result, SyncOutcome.CANCELLED);
            }

            result.setStage(SyncStage.MERGE);
            MergeResult merge = mailboxMergeService.merge(account, fetch.getMessages());
            result.setIngested(merge.getIngested().size());
            MailAccount fresh = current.get();
            if (merge.getFailures() == 0) {
                fresh.setSyncCursor(fetch.getNewCursor());
                result.setCursorAdvanced(true);
            } else {
                result.getErrors().add(merge.getFailures() + " messages failed to merge, cursor kept");
            }
            fresh.setLastSyncAt(Instant.now());
            fresh.setSyncStatus(SyncStatus.ACTIVE);
            fresh.setLastError(null);
            mailAccountRepository.save(fresh);
            if (activeAccount(accountId).isEmpty()) {
                return finish(result, SyncOutcome.CANCELLED);
            }

            result.setStage(SyncStage.CLASSIFY);
            List<MailMessage> classified = classificationGate.classify(account, merge.getIngested());
            result.setClassified(classified.size());
            if (activeAccount(accountId).isEmpty()) {
                return finish(result, SyncOutcome.CANCELLED);
            }

            result.setStage(SyncStage.LABEL_SYNC);
            result.setLabelsUpdated(labelSyncService.pushLabels(account, provider, classified));

            result.setStage(SyncStage.NOTIFY);
            result.setNotified(notificationDispatcher.dispatch(merge.getIngested()));

            result.setStage(SyncStage.IDLE);
            return finish(result, SyncOutcome.COMPLETED);
        } catch (ProviderAuthException e) {
            log.warn("Credentials rejected for account {}, pausing sync until they are refreshed: {}",
                    account.getEmailAddress(), e.getMessage());
            markAccount(accountId, SyncStatus.EXPIRED, e.getMessage());
            result.getErrors().add(e.getMessage());
            return finish(result, SyncOutcome.AUTH_FAILED);
        } catch (ProviderException e) {
            log.warn("Provider unavailable for account {} during {}: {}", account.getEmailAddress(), result.getStage(), e.getMessage());
            markAccount(accountId, SyncStatus.ERROR, e.getMessage());
            result.getErrors().add(e.getMessage());
            return finish(result, SyncOutcome.PROVIDER_UNAVAILABLE);
        } catch (RuntimeException e) {
            log.error("Sync cycle failed for account {} during {}: {}", account.getEmailAddress(), result.getStage(), e.getMessage(), e);
            markAccount(accountId, SyncStatus.ERROR, e.getMessage());
            result.getErrors().add(e.getMessage());
            return finish(result, SyncOutcome.FAILED);
        }
    }

    private Optional<MailAccount> activeAccount(String accountId) {
        Optional<MailAccount> account = mailAccountRepository.findById(accountId);
        if (account.isEmpty() || !account.get().isEnabled()) {
            log.info("Account {} was deleted or disabled, stopping its sync cycle", accountId);
            return Optional.empty();
        }
        return account;
    }

    private void markAccount(String accountId, SyncStatus status, String error) {
        mailAccountRepository.findById(accountId).ifPresent(account -> {
            account.setSyncStatus(status);
            account.setLastError(error);
            mailAccountRepository.save(account);
        });
    }

    private SyncResult finish(SyncResult result, SyncOutcome outcome) {
        result.setOutcome(outcome);
        result.setFinishedAt(Instant.now());
        lastResults.put(result.getAccountId(), result);
        log.info("Sync cycle for account {} finished: {} at {} ({} ops completed, {} cancelled, {} failed, {} fetched, {} new, {} classified, {} labelled, {} notified) in {} ms",
                result.getEmailAddress() != null ? result.getEmailAddress() : result.getAccountId(),
                outcome, result.getStage(), result.getOperationsCompleted(), result.getOperationsCancelled(),
                result.getOperationsFailed(), result.getFetched(), result.getIngested(), result.getClassified(),
                result.getLabelsUpdated(), result.getNotified(), result.getDurationMs());
        return result;
    }

    public Map<String, SyncResult> getLastResults() {
        return Collections.unmodifiableMap(lastResults);
    }

    /**
     * True while any node holds the account's sync lock.
     */
    public boolean isRunning(String accountId) {
        return accountSyncLockService.isLocked(accountId);
    }
}
