package axios.mail.sync.ai;

import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.MailMessage;
import axios.mail.sync.repository.MailMessageRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies newly ingested messages before anything is notified.
 * <p>
 * A message whose classification fails keeps {@code classified = false} and is picked up again
 * from the backlog in a later cycle. Manually tagged messages are never touched.
 */
@Slf4j
@Service
public class ClassificationGate {
    private final MessageClassifier messageClassifier;
    private final MailMessageRepository mailMessageRepository;

    @Value("${mailsync.classification.max-per-cycle:100}")
    private int maxPerCycle = 100;

    public ClassificationGate(MessageClassifier messageClassifier, MailMessageRepository mailMessageRepository) {
        this.messageClassifier = messageClassifier;
        this.mailMessageRepository = mailMessageRepository;
    }

    /**
     * @param account Account being synced
     * @param ingested Messages stored for the first time in this cycle
     * @return Messages classified and saved in this call, as stored
     */
    public List<MailMessage> classify(MailAccount account, List<MailMessage> ingested) {
        List<MailMessage> candidates = selectCandidates(account, ingested);
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }

        List<MailMessage> classified = new ArrayList<>();
        int failed = 0;
        for (MailMessage message : candidates) {
            try {
                Classification classification = messageClassifier.classify(message);
                apply(message, classification);
                MailMessage saved = persist(message, classification);
                if (saved != null) {
                    classified.add(saved);
                }
            } catch (InferenceException e) {
                failed++;
                if (e.isTimeout()) {
                    log.warn("Classification timed out for message {}, leaving it unclassified", message.getId());
                } else {
                    log.warn("Classification failed for message {}: {}", message.getId(), e.getMessage());
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Unexpected error classifying message {}: {}", message.getId(), e.getMessage(), e);
            }
        }
        log.info("Classified {}/{} messages for account {} ({} left for a later cycle)",
                classified.size(), candidates.size(), account.getEmailAddress(), failed);
        return classified;
    }

    /**
     * Saves the classification. If the row was written meanwhile (read state, folder, manual tags)
     * the classification is applied to a fresh copy instead, unless that copy is no longer eligible.
     * @return the classified message, or null if it was skipped
     */
    private MailMessage persist(MailMessage message, Classification classification) {
        try {
            mailMessageRepository.save(message);
            return message;
        } catch (OptimisticLockingFailureException e) {
            MailMessage fresh = mailMessageRepository.findById(message.getId()).orElse(null);
            if (fresh == null || !isEligible(fresh)) {
                log.info("Message {} changed during classification and is no longer eligible, skipping", message.getId());
                return null;
            }
            apply(fresh, classification);
            mailMessageRepository.save(fresh);
            return fresh;
        }
    }

    private List<MailMessage> selectCandidates(MailAccount account, List<MailMessage> ingested) {
        Map<String, MailMessage> candidates = new LinkedHashMap<>();
        for (MailMessage message : ingested) {
            if (isEligible(message)) {
                candidates.put(message.getId(), message);
            }
        }
        if (candidates.size() < maxPerCycle) {
            List<MailMessage> backlog = mailMessageRepository
                    .findByAccountIdAndClassifiedFalseAndManuallyTaggedFalseAndFolderNotOrderByIngestedAtAsc(
                            account.getId(), Folder.DELETING, PageRequest.of(0, maxPerCycle));
            for (MailMessage message : backlog) {
                if (candidates.size() >= maxPerCycle) {
                    break;
                }
                candidates.putIfAbsent(message.getId(), message);
            }
        }

        List<MailMessage> selected = new ArrayList<>(candidates.values());
        return selected.size() > maxPerCycle ? selected.subList(0, maxPerCycle) : selected;
    }

    private boolean isEligible(MailMessage message) {
        return !message.isClassified() && !message.isManuallyTagged() && message.getFolder() != Folder.DELETING;
    }

    private void apply(MailMessage message, Classification classification) {
        message.setTags(new HashSet<>(classification.getTags()));
        message.setConfidence(classification.getConfidence());
        message.setPriority(classification.getPriority());
        message.setActionRequired(classification.isActionRequired());
        message.setCanArchive(classification.isCanArchive());
        message.setClassified(true);
    }

    /**
     * Replaces the tags of a message with the user's choice. Manually tagged messages are never reclassified.
     * @throws EntityNotFoundException if the message does not exist
     * @throws IllegalArgumentException if a tag is not part of the taxonomy
     */
    @Transactional
    public MailMessage tagManually(String messageId, Set<String> tags) {
        MailMessage message = mailMessageRepository.findById(messageId)
                .orElseThrow(() -> new EntityNotFoundException("Message not found: " + messageId));
        Set<String> normalized = new HashSet<>();
        for (String tag : tags) {
            String name = tag.trim().toLowerCase();
            if (!MessageClassifier.taxonomy().contains(name)) {
                throw new IllegalArgumentException("Unknown tag: " + tag);
            }
            normalized.add(name);
        }
        message.setTags(normalized);
        message.setManuallyTagged(true);
        message.setClassified(true);
        message.setConfidence(1.0);
        log.info("Message {} tagged manually: {}", messageId, normalized);
        return mailMessageRepository.save(message);
    }
}
