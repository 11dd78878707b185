package axios.mail.sync.provider;

import axios.mail.sync.entity.ImapSettings;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;

import java.io.IOException;

/**
 * Opens an authenticated IMAP store for an account.
 */
public interface ImapStoreConnector {
    /**
     * @param settings Server and login settings of the account
     * @return A connected store, owned by the caller
     * @throws MessagingException if the server cannot be reached or rejects the login
     * @throws IOException if the password file cannot be read
     */
    Store connect(ImapSettings settings) throws MessagingException, IOException;
}
