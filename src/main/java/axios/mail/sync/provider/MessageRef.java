package axios.mail.sync.provider;

import axios.mail.sync.entity.MailMessage;
import axios.mail.sync.entity.PendingOperation;
import lombok.Value;

/**
 * Remote identity of a message targeted by a mutation or label update.
 */
@Value
public class MessageRef {
    String remoteId;
    // RFC 5322 Message-ID, lets IMAP find a message after it changed mailbox
    String internetMessageId;

    public static MessageRef of(PendingOperation operation) {
        return new MessageRef(operation.getRemoteId(), operation.getInternetMessageId());
    }

    public static MessageRef of(MailMessage message) {
        return new MessageRef(message.getRemoteId(), message.getInternetMessageId());
    }
}
