package axios.mail.sync.service;

import axios.mail.sync.ai.MessageClassifier;
import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.MailMessage;
import axios.mail.sync.provider.MailProvider;
import axios.mail.sync.provider.MessageRef;
import axios.mail.sync.provider.ProviderAuthException;
import axios.mail.sync.provider.ProviderException;
import axios.mail.sync.provider.RemoteNotFoundException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes classification results back to the provider as labels, so other mail clients see them.
 * <p>
 * Best effort: a failure on one message is logged and the next one is tried. The local tags stay
 * authoritative, nothing here changes the mailbox store.
 */
@Slf4j
@Service
public class LabelSyncService {
    static final String PRIORITY_LABEL = "Priority";
    static final String TODO_LABEL = "ToDo";

    @Value("${mailsync.labels.enabled:true}")
    private boolean enabled = true;

    @Value("${mailsync.labels.prefix:AI}")
    private String prefix = "AI";

    @Value("${mailsync.labels.archive:true}")
    private boolean archive = true;

    @Getter
    public static class LabelChange {
        private final Set<String> add;
        private final Set<String> remove;

        LabelChange(Set<String> add, Set<String> remove) {
            this.add = add;
            this.remove = remove;
        }

        public boolean isEmpty() {
            return add.isEmpty() && remove.isEmpty();
        }
    }

    /**
     * @param classified Messages classified in this cycle
     * @return Number of messages whose labels were updated remotely
     */
    public int pushLabels(MailAccount account, MailProvider provider, List<MailMessage> classified) {
        if (!enabled || classified.isEmpty()) {
            return 0;
        }

        int updated = 0;
        for (MailMessage message : classified) {
            if (message.getRemoteId() == null || message.getFolder() == Folder.DELETING) {
                continue;
            }
            LabelChange change = computeChanges(message);
            if (change.isEmpty()) {
                continue;
            }
            try {
                provider.updateLabels(MessageRef.of(message), change.getAdd(), change.getRemove());
                updated++;
            } catch (ProviderAuthException e) {
                log.warn("Credentials rejected while labelling messages of account {}, skipping the rest: {}",
                        account.getEmailAddress(), e.getMessage());
                break;
            } catch (RemoteNotFoundException e) {
                log.debug("Message {} is gone remotely, no labels written", message.getId());
            } catch (ProviderException e) {
                log.warn("Failed to update labels of message {}: {}", message.getId(), e.getMessage());
            }
        }
        log.info("Updated provider labels of {}/{} classified messages for account {}",
                updated, classified.size(), account.getEmailAddress());
        return updated;
    }

    /**
     * Labels are {@code <prefix>/<Tag>} plus {@code <prefix>/Priority} for high priority and
     * {@code <prefix>/ToDo} when an action is required. Every other label this service manages is
     * removed, and the inbox label too when archiving is enabled and the message may be archived.
     */
    LabelChange computeChanges(MailMessage message) {
        Set<String> add = new LinkedHashSet<>();
        for (String tag : message.getTags()) {
            add.add(label(tag));
        }
        if ("high".equals(message.getPriority())) {
            add.add(prefix + "/" + PRIORITY_LABEL);
        }
        if (message.isActionRequired()) {
            add.add(prefix + "/" + TODO_LABEL);
        }

        Set<String> remove = new LinkedHashSet<>();
        for (String tag : MessageClassifier.taxonomy()) {
            remove.add(label(tag));
        }
        remove.add(prefix + "/" + PRIORITY_LABEL);
        remove.add(prefix + "/" + TODO_LABEL);
        remove.removeAll(add);

        if (archive && message.isCanArchive() && message.getFolder() == Folder.INBOX) {
            remove.add(MailProvider.INBOX_LABEL);
        }
        return new LabelChange(add, remove);
    }

    private String label(String tag) {
        return prefix + "/" + Character.toUpperCase(tag.charAt(0)) + tag.substring(1);
    }
}
