package axios.mail.sync.provider;

import axios.mail.sync.entity.ImapSettings;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

@Slf4j
@Component
public class JakartaImapStoreConnector implements ImapStoreConnector {
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public JakartaImapStoreConnector(@Value("${mailsync.imap.connect-timeout-ms:30000}") int connectTimeoutMs,
                                     @Value("${mailsync.imap.read-timeout-ms:60000}") int readTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    @Override
    public Store connect(ImapSettings settings) throws MessagingException, IOException {
        boolean ssl = settings.getSsl() == null || settings.getSsl();
        String protocol = ssl ? "imaps" : "imap";

        Properties props = new Properties();
        props.put("mail.store.protocol", protocol);
        props.put("mail." + protocol + ".connectiontimeout", String.valueOf(connectTimeoutMs));
        props.put("mail." + protocol + ".timeout", String.valueOf(readTimeoutMs));
        // reading a body must not set \Seen behind the user's back
        props.put("mail." + protocol + ".peek", "true");
        if (!ssl) {
            props.put("mail.imap.starttls.enable", "true");
        }

        String password = readPassword(settings.getPasswordFile());
        Session session = Session.getInstance(props);
        Store store = session.getStore(protocol);
        int port = settings.getPort() != null ? settings.getPort() : (ssl ? 993 : 143);
        log.debug("Connecting to {}://{}:{} as {}", protocol, settings.getHost(), port, settings.getUsername());
        store.connect(settings.getHost(), port, settings.getUsername(), password);
        return store;
    }

    private String readPassword(String passwordFile) throws IOException {
        if (passwordFile == null || passwordFile.isBlank()) {
            throw new IOException("No password file configured");
        }
        return Files.readString(Path.of(passwordFile)).trim();
    }
}
