package axios.mail.sync.controller;

import axios.mail.sync.entity.PushSubscription;
import axios.mail.sync.notify.PushSubscriptionService;
import lombok.Data;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.Map;

@RestController
@RequestMapping("/api/push")
public class PushSubscriptionController {
    private final PushSubscriptionService pushSubscriptionService;

    public PushSubscriptionController(PushSubscriptionService pushSubscriptionService) {
        this.pushSubscriptionService = pushSubscriptionService;
    }

    /**
     * Body of the browser's {@code PushSubscription.toJSON()}.
     */
    @Data
    public static class SubscribeRequest {
        private String endpoint;
        private Keys keys;

        @Data
        public static class Keys {
            private String p256dh;
            private String auth;
        }
    }

    @PostMapping("/subscribe")
    public Map<String, String> subscribe(@RequestBody SubscribeRequest request) {
        if (request.getKeys() == null) {
            throw new IllegalArgumentException("Subscription keys are required");
        }
        PushSubscription subscription = pushSubscriptionService.subscribe(
                request.getEndpoint(), request.getKeys().getP256dh(), request.getKeys().getAuth());
        return Collections.singletonMap("id", subscription.getId());
    }

    @DeleteMapping("/unsubscribe")
    public ResponseEntity<Void> unsubscribe(@RequestParam String endpoint) {
        return pushSubscriptionService.unsubscribe(endpoint)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
