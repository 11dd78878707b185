package axios.mail.sync.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "mail_messages", indexes = {
        @Index(name = "idx_mail_messages_account_remote", columnList = "accountId, remoteId"),
        @Index(name = "idx_mail_messages_account_folder", columnList = "accountId, folder")
})
@Getter
@Setter
@ToString(exclude = {"bodyText", "bodyHtml"})
public class MailMessage {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    // bumped on every write, a save from a stale copy fails instead of overwriting newer state
    @Version
    @Column(columnDefinition = "BIGINT DEFAULT 0")
    private Long version;

    private String accountId;

    private String remoteId;

    @Column(length = 1000)
    private String internetMessageId;

    @Column(length = 1000)
    private String threadId;

    @Enumerated(EnumType.STRING)
    private Folder folder = Folder.INBOX;

    // where a trashed message goes back to on restore
    @Enumerated(EnumType.STRING)
    private Folder originalFolder;

    @Column(length = 1000)
    private String fromAddress;

    @Column(columnDefinition = "TEXT")
    private String toAddresses;

    @Column(length = 2000)
    private String subject;

    private Instant sentAt;

    @Column(columnDefinition = "TEXT")
    private String snippet;

    @Column(columnDefinition = "TEXT")
    private String bodyText;

    @Column(columnDefinition = "TEXT")
    private String bodyHtml;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "mail_message_tags", joinColumns = @JoinColumn(name = "message_id"))
    @Column(name = "tag")
    private Set<String> tags = new HashSet<>();

    private Double confidence;

    // "high" or "normal", set by classification
    private String priority;

    private boolean actionRequired;

    private boolean canArchive;

    private boolean read;

    private boolean classified;

    private boolean manuallyTagged;

    private Instant ingestedAt;
}
