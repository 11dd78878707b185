package axios.mail.sync.entity;

public enum SyncStatus {
    ACTIVE,
    // credentials rejected, waits for the user to re-authenticate
    EXPIRED,
    ERROR
}
