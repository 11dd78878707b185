package axios.mail.sync.notify;

import axios.mail.sync.entity.PushSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Posts {@code {"subscription": {...}, "payload": {...}}} to the configured relay URL.
 */
@Slf4j
@Component
public class HttpPushRelayClient implements PushRelayClient {
    private final RestTemplate restTemplate;
    private final String relayUrl;

    public HttpPushRelayClient(@Value("${mailsync.push.relay-url:}") String relayUrl,
                               @Value("${mailsync.push.timeout-ms:10000}") int timeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        this.restTemplate = new RestTemplate(requestFactory);
        this.relayUrl = relayUrl;
    }

    @Override
    public DeliveryOutcome deliver(PushSubscription subscription, PushPayload payload) {
        if (relayUrl == null || relayUrl.isBlank()) {
            log.warn("Cannot send push: mailsync.push.relay-url is not configured");
            return DeliveryOutcome.FAILED;
        }

        Map<String, Object> keys = new HashMap<>();
        keys.put("p256dh", subscription.getP256dh());
        keys.put("auth", subscription.getAuth());
        Map<String, Object> subscriptionInfo = new HashMap<>();
        subscriptionInfo.put("endpoint", subscription.getEndpoint());
        subscriptionInfo.put("keys", keys);

        Map<String, Object> body = new HashMap<>();
        body.put("subscription", subscriptionInfo);
        body.put("payload", payload);

        try {
            restTemplate.postForEntity(relayUrl, body, String.class);
            return DeliveryOutcome.DELIVERED;
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()
                    || e.getStatusCode().value() == HttpStatus.GONE.value()) {
                return DeliveryOutcome.SUBSCRIPTION_GONE;
            }
            log.error("Push relay rejected notification with {}: {}", e.getStatusCode(), e.getMessage());
            return DeliveryOutcome.FAILED;
        } catch (RestClientException e) {
            log.error("Push relay unreachable: {}", e.getMessage());
            return DeliveryOutcome.FAILED;
        }
    }
}
