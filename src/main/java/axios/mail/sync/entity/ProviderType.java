package axios.mail.sync.entity;

public enum ProviderType {
    GMAIL,
    IMAP
}
