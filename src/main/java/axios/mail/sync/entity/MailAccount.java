package axios.mail.sync.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Entity
@Table(name = "mail_accounts")
@Getter
@Setter
@ToString(exclude = "token")
public class MailAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    private String emailAddress;

    @Enumerated(EnumType.STRING)
    private ProviderType providerType;

    private boolean enabled = true;

    @Embedded
    private OAuthToken token;

    @Embedded
    private ImapSettings imap;

    // Gmail historyId or IMAP "uidValidity:lastUid"
    private String syncCursor;

    @Enumerated(EnumType.STRING)
    private SyncStatus syncStatus = SyncStatus.ACTIVE;

    private Instant lastSyncAt;

    @Column(columnDefinition = "TEXT")
    private String lastError;
}
