package axios.mail.sync.notify;

import axios.mail.sync.entity.PushSubscription;
import axios.mail.sync.repository.PushSubscriptionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
public class PushSubscriptionService {
    private final PushSubscriptionRepository pushSubscriptionRepository;

    public PushSubscriptionService(PushSubscriptionRepository pushSubscriptionRepository) {
        this.pushSubscriptionRepository = pushSubscriptionRepository;
    }

    /**
     * Stores a browser subscription. Subscribing an endpoint again replaces its keys.
     */
    @Transactional
    public PushSubscription subscribe(String endpoint, String p256dh, String auth) {
        if (endpoint == null || endpoint.isBlank() || p256dh == null || auth == null) {
            throw new IllegalArgumentException("Subscription needs an endpoint, a p256dh key and an auth secret");
        }
        PushSubscription subscription = pushSubscriptionRepository.findByEndpoint(endpoint).orElseGet(() -> {
            PushSubscription created = new PushSubscription();
            created.setEndpoint(endpoint);
            created.setCreatedAt(Instant.now());
            return created;
        });
        subscription.setP256dh(p256dh);
        subscription.setAuth(auth);
        log.info("Push subscription registered: {}", endpoint.length() > 50 ? endpoint.substring(0, 50) + "..." : endpoint);
        return pushSubscriptionRepository.save(subscription);
    }

    /**
     * @return true if a subscription was removed
     */
    @Transactional
    public boolean unsubscribe(String endpoint) {
        Optional<PushSubscription> subscription = pushSubscriptionRepository.findByEndpoint(endpoint);
        subscription.ifPresent(pushSubscriptionRepository::delete);
        return subscription.isPresent();
    }
}
