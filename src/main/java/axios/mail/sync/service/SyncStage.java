package axios.mail.sync.service;

/**
 * Stages of one account sync cycle, in execution order.
 */
public enum SyncStage {
    DRAIN_QUEUE,
    FETCH_REMOTE,
    MERGE,
    CLASSIFY,
    LABEL_SYNC,
    NOTIFY,
    IDLE
}
