package axios.mail.sync.provider;

import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.service.TokenRefreshService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates the provider adapter matching an account's provider type.
 */
@Component
public class MailProviderFactory {
    private final GmailClientFactory gmailClientFactory;
    private final TokenRefreshService tokenRefreshService;
    private final ImapStoreConnector imapStoreConnector;
    private final int maxMessages;

    public MailProviderFactory(GmailClientFactory gmailClientFactory,
                               TokenRefreshService tokenRefreshService,
                               ImapStoreConnector imapStoreConnector,
                               @Value("${mailsync.sync.max-messages:100}") int maxMessages) {
        this.gmailClientFactory = gmailClientFactory;
        this.tokenRefreshService = tokenRefreshService;
        this.imapStoreConnector = imapStoreConnector;
        this.maxMessages = maxMessages;
    }

    public MailProvider create(MailAccount account) {
        if (account.getProviderType() == null) {
            throw new IllegalStateException("Account " + account.getId() + " has no provider type");
        }
        switch (account.getProviderType()) {
            case GMAIL:
                return new GmailProvider(account, gmailClientFactory, tokenRefreshService, maxMessages);
            case IMAP:
                if (account.getImap() == null || account.getImap().getHost() == null) {
                    throw new IllegalStateException("IMAP account " + account.getEmailAddress() + " has no server settings");
                }
                return new ImapProvider(account, imapStoreConnector, maxMessages);
            default:
                throw new IllegalStateException("Unsupported provider type: " + account.getProviderType());
        }
    }
}
