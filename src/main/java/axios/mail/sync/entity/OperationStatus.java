package axios.mail.sync.entity;

public enum OperationStatus {
    PENDING,
    COMPLETED,
    FAILED
}
