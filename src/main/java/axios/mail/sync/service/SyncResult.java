package axios.mail.sync.service;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one sync cycle, kept per account for the status endpoint.
 */
@Data
public class SyncResult {
    private String accountId;
    private String emailAddress;
    private Instant startedAt;
    private Instant finishedAt;
    private SyncStage stage;
    private SyncOutcome outcome;
    private int operationsCompleted;
    private int operationsCancelled;
    private int operationsFailed;
    private int fetched;
    private int ingested;
    private int classified;
    private int labelsUpdated;
    private int notified;
    private boolean cursorAdvanced;
    private List<String> errors = new ArrayList<>();

    public long getDurationMs() {
        if (startedAt == null || finishedAt == null) {
            return 0;
        }
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
