package axios.mail.sync.entity;

/**
 * Local folder of a cached message. {@link #DELETING} is transient: the message
 * is gone for the user and waits for its queued delete to reach the provider.
 */
public enum Folder {
    INBOX,
    SENT,
    TRASH,
    DELETING
}
