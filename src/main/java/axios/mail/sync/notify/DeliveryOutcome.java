package axios.mail.sync.notify;

public enum DeliveryOutcome {
    DELIVERED,
    // the push service no longer knows the subscription (HTTP 404/410)
    SUBSCRIPTION_GONE,
    FAILED
}
