package axios.mail.sync.service;

import lombok.Data;

/**
 * Counters of one queue drain.
 */
@Data
public class DrainResult {
    private int completed;
    private int cancelled;
    // transient failures that stay pending for the next cycle
    private int retrying;
    private int failed;
    // pending operations left for the next drain because of the per-drain cap
    private int deferred;
}
