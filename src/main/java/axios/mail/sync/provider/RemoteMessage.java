package axios.mail.sync.provider;

import axios.mail.sync.entity.Folder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Provider-neutral snapshot of a remote message as returned by {@link MailProvider#fetchChanges}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoteMessage {
    private String remoteId;
    private String internetMessageId;
    private String threadId;
    private Folder folder;
    private String from;
    private String to;
    private String subject;
    private Instant sentAt;
    private String snippet;
    private String bodyText;
    private String bodyHtml;
    private boolean read;
}
