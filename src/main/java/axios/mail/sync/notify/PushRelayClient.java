package axios.mail.sync.notify;

import axios.mail.sync.entity.PushSubscription;

/**
 * Hands notifications to the external push relay that performs the Web Push encryption and delivery.
 */
public interface PushRelayClient {
    /**
     * Deliver one payload to one subscription. Never throws for delivery problems.
     * @param subscription Browser subscription to deliver to
     * @param payload Notification content
     * @return The delivery outcome reported by the relay
     */
    DeliveryOutcome deliver(PushSubscription subscription, PushPayload payload);
}
