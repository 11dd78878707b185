package axios.mail.sync.service;

public enum SyncOutcome {
    COMPLETED,
    // account disabled or deleted while the cycle was running
    CANCELLED,
    AUTH_FAILED,
    PROVIDER_UNAVAILABLE,
    FAILED
}
