package axios.mail.sync.notify;

import axios.mail.sync.ai.MessageClassifier;
import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailMessage;
import axios.mail.sync.entity.PushSubscription;
import axios.mail.sync.repository.PushSubscriptionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Sends web push notifications for messages ingested in the current cycle.
 * At most {@code mailsync.push.max-per-cycle} messages are notified per cycle, the rest are dropped.
 */
@Slf4j
@Service
public class NotificationDispatcher {
    private static final Set<Folder> EXCLUDED_FOLDERS = EnumSet.of(Folder.SENT, Folder.TRASH, Folder.DELETING);
    private static final Set<String> SILENT_TAGS = new HashSet<>(Arrays.asList(
            MessageClassifier.TAG_JUNK, MessageClassifier.TAG_NEWSLETTER, MessageClassifier.TAG_SYSTEM));

    private final PushSubscriptionRepository pushSubscriptionRepository;
    private final PushRelayClient pushRelayClient;

    @Value("${mailsync.push.enabled:true}")
    private boolean enabled = true;

    @Value("${mailsync.push.max-per-cycle:5}")
    private int maxPerCycle = 5;

    public NotificationDispatcher(PushSubscriptionRepository pushSubscriptionRepository, PushRelayClient pushRelayClient) {
        this.pushSubscriptionRepository = pushSubscriptionRepository;
        this.pushRelayClient = pushRelayClient;
    }

    /**
     * @param ingested Messages stored for the first time in this cycle, already classified where possible
     * @return Number of successful deliveries
     */
    public int dispatch(List<MailMessage> ingested) {
        if (!enabled || ingested.isEmpty()) {
            return 0;
        }

        List<MailMessage> eligible = new ArrayList<>();
        for (MailMessage message : ingested) {
            if (isEligible(message)) {
                eligible.add(message);
                if (eligible.size() == maxPerCycle) {
                    break;
                }
            }
        }
        if (eligible.isEmpty()) {
            return 0;
        }

        List<PushSubscription> subscriptions = new ArrayList<>(pushSubscriptionRepository.findAll());
        if (subscriptions.isEmpty()) {
            return 0;
        }

        int delivered = 0;
        for (MailMessage message : eligible) {
            PushPayload payload = buildPayload(message);
            for (PushSubscription subscription : new ArrayList<>(subscriptions)) {
                try {
                    DeliveryOutcome outcome = pushRelayClient.deliver(subscription, payload);
                    switch (outcome) {
                        case DELIVERED:
                            delivered++;
                            subscription.setLastUsedAt(Instant.now());
                            pushSubscriptionRepository.save(subscription);
                            break;
                        case SUBSCRIPTION_GONE:
                            log.info("Removing expired push subscription: {}", abbreviate(subscription.getEndpoint()));
                            pushSubscriptionRepository.delete(subscription);
                            subscriptions.remove(subscription);
                            break;
                        default:
                            log.warn("Push delivery failed for message {} to {}", message.getId(), abbreviate(subscription.getEndpoint()));
                            break;
                    }
                } catch (RuntimeException e) {
                    log.error("Unexpected push error for message {}: {}", message.getId(), e.getMessage(), e);
                }
            }
        }

        if (delivered > 0) {
            log.info("Sent {} push notification(s) for {} new message(s)", delivered, eligible.size());
        }
        return delivered;
    }

    boolean isEligible(MailMessage message) {
        if (EXCLUDED_FOLDERS.contains(message.getFolder())) {
            return false;
        }
        for (String tag : message.getTags()) {
            if (SILENT_TAGS.contains(tag)) {
                return false;
            }
        }
        return true;
    }

    static PushPayload buildPayload(MailMessage message) {
        String subject = message.getSubject() != null && !message.getSubject().isBlank()
                ? message.getSubject() : "(no subject)";
        return PushPayload.builder()
                .title("New email from " + senderName(message.getFromAddress()))
                .body(subject)
                .url("/?message=" + message.getId())
                .tag("new-email")
                .build();
    }

    // "Jane Doe <jane@example.com>" -> "Jane Doe"
    static String senderName(String from) {
        if (from == null || from.isBlank()) {
            return "Unknown";
        }
        int bracket = from.indexOf('<');
        if (bracket > 0) {
            String name = from.substring(0, bracket).trim().replace("\"", "");
            if (!name.isEmpty()) {
                return name;
            }
        }
        return from.trim();
    }

    private static String abbreviate(String endpoint) {
        return endpoint != null && endpoint.length() > 50 ? endpoint.substring(0, 50) + "..." : endpoint;
    }
}
