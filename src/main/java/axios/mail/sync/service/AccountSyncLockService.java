package axios.mail.sync.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Serializes sync cycles per account with a lock row in the database.
 * A second trigger for a locked account is coalesced by its caller. Locks expire so that a
 * crashed node cannot block an account forever; this also makes the lock safe across nodes.
 */
@Slf4j
@Service
public class AccountSyncLockService {
    private static final String LOCK_TABLE = "account_sync_locks";

    private final JdbcTemplate jdbcTemplate;
    private final int lockTimeoutMinutes;

    public AccountSyncLockService(JdbcTemplate jdbcTemplate,
                                  @Value("${mailsync.lock.timeout-minutes:10}") int lockTimeoutMinutes) {
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeoutMinutes = lockTimeoutMinutes;
        initializeLockTable();
    }

    private void initializeLockTable() {
        try {
            jdbcTemplate.execute(
                    "CREATE TABLE IF NOT EXISTS " + LOCK_TABLE + " (" +
                    "account_id VARCHAR(255) PRIMARY KEY, " +
                    "locked_by VARCHAR(255) NOT NULL, " +
                    "locked_at TIMESTAMP NOT NULL, " +
                    "expires_at TIMESTAMP NOT NULL" +
                    ")"
            );
            log.debug("Sync lock table initialized");
        } catch (DataAccessException e) {
            log.warn("Could not initialize sync lock table (may already exist): {}", e.getMessage());
        }
    }

    /**
     * Attempts to acquire the sync lock of an account.
     * @param accountId The account to lock
     * @param nodeId Identifier of this node
     * @return true if the lock was acquired, false if a cycle already holds it
     */
    public boolean tryLock(String accountId, String nodeId) {
        try {
            Timestamp now = Timestamp.from(Instant.now());
            if (insertLock(accountId, nodeId, now)) {
                log.debug("Acquired sync lock for account: {}", accountId);
                return true;
            }

            int expired = jdbcTemplate.update(
                    "DELETE FROM " + LOCK_TABLE + " WHERE account_id = ? AND expires_at < ?",
                    accountId, now
            );
            if (expired > 0) {
                log.warn("Removed expired sync lock for account {}", accountId);
                if (insertLock(accountId, nodeId, now)) {
                    return true;
                }
            }

            log.debug("Sync already in progress for account: {}", accountId);
            return false;
        } catch (DataAccessException e) {
            log.error("Error acquiring sync lock for account {}: {}", accountId, e.getMessage(), e);
            return false;
        }
    }

    private boolean insertLock(String accountId, String nodeId, Timestamp now) {
        Timestamp expiresAt = Timestamp.from(now.toInstant().plusSeconds(TimeUnit.MINUTES.toSeconds(lockTimeoutMinutes)));
        try {
            return jdbcTemplate.update(
                    "INSERT INTO " + LOCK_TABLE + " (account_id, locked_by, locked_at, expires_at) VALUES (?, ?, ?, ?)",
                    accountId, nodeId, now, expiresAt
            ) > 0;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    /**
     * Releases the sync lock of an account held by this node.
     */
    public void releaseLock(String accountId, String nodeId) {
        try {
            int rows = jdbcTemplate.update(
                    "DELETE FROM " + LOCK_TABLE + " WHERE account_id = ? AND locked_by = ?",
                    accountId, nodeId
            );
            if (rows > 0) {
                log.debug("Released sync lock for account: {}", accountId);
            } else {
                log.warn("Sync lock for account {} was not held by {}", accountId, nodeId);
            }
        } catch (DataAccessException e) {
            log.error("Error releasing sync lock for account {}: {}", accountId, e.getMessage(), e);
        }
    }

    /**
     * @return true if an unexpired lock row exists for the account, on any node
     */
    public boolean isLocked(String accountId) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM " + LOCK_TABLE + " WHERE account_id = ? AND expires_at > ?",
                    Integer.class, accountId, Timestamp.from(Instant.now())
            );
            return count != null && count > 0;
        } catch (DataAccessException e) {
            log.warn("Could not read sync lock of account {}: {}", accountId, e.getMessage());
            return false;
        }
    }

    /**
     * Gets the node ID for this instance (hostname or environment variable).
     */
    public String getNodeId() {
        String nodeId = System.getenv("MAILSYNC_NODE_ID");
        if (nodeId == null || nodeId.isEmpty()) {
            nodeId = System.getenv("HOSTNAME");
        }
        if (nodeId == null || nodeId.isEmpty()) {
            nodeId = System.getProperty("user.name") + "-" + ProcessHandle.current().pid();
        }
        return nodeId;
    }
}
