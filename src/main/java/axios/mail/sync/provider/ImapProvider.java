package axios.mail.sync.provider;

import axios.mail.sync.entity.ImapSettings;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.OperationKind;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.MessageIDTerm;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * IMAP adapter. Only the inbox is scanned for changes; the cursor is
 * {@code "<uidValidity>:<highest uid seen>"}, so a UIDVALIDITY change forces a rescan.
 * Remote ids are inbox UIDs. A message that moved to trash is found again through its Message-ID.
 */
@Slf4j
public class ImapProvider implements MailProvider {
    private static final int SNIPPET_LENGTH = 200;
    private static final String KEYWORD_PREFIX = "$";

    private final MailAccount account;
    private final ImapSettings settings;
    private final ImapStoreConnector connector;
    private final int maxMessages;

    private Store store;
    private final Map<String, Folder> openFolders = new HashMap<>();

    public ImapProvider(MailAccount account, ImapStoreConnector connector, int maxMessages) {
        this.account = account;
        this.settings = account.getImap();
        this.connector = connector;
        this.maxMessages = maxMessages;
    }

    @Override
    public FetchResult fetchChanges(String cursor) throws ProviderException {
        try {
            Folder inbox = folder(settings.getInboxFolder());
            UIDFolder uidFolder = (UIDFolder) inbox;
            long uidValidity = uidFolder.getUIDValidity();

            long lastUid = parseLastUid(cursor, uidValidity);
            Message[] candidates;
            if (lastUid < 0) {
                int count = inbox.getMessageCount();
                candidates = count == 0
                        ? new Message[0]
                        : inbox.getMessages(Math.max(1, count - maxMessages + 1), count);
            } else {
                candidates = uidFolder.getMessagesByUID(lastUid + 1, UIDFolder.LASTUID);
            }

            FetchProfile profile = new FetchProfile();
            profile.add(FetchProfile.Item.ENVELOPE);
            profile.add(FetchProfile.Item.FLAGS);
            profile.add(UIDFolder.FetchProfileItem.UID);
            inbox.fetch(candidates, profile);

            List<RemoteMessage> messages = new ArrayList<>();
            long highestUid = Math.max(lastUid, 0);
            for (Message message : candidates) {
                if (message == null || message.isExpunged()) {
                    continue;
                }
                long uid = uidFolder.getUID(message);
                // "n:*" always returns the newest message even if its uid is below n
                if (uid <= lastUid) {
                    continue;
                }
                if (messages.size() >= maxMessages) {
                    break;
                }
                messages.add(toRemoteMessage(message, uid));
                highestUid = Math.max(highestUid, uid);
            }

            String newCursor = uidValidity + ":" + highestUid;
            log.info("Fetched {} new IMAP messages for account {}, cursor {}", messages.size(), account.getEmailAddress(), newCursor);
            return new FetchResult(messages, newCursor);
        } catch (MessagingException e) {
            throw translate("fetch", e);
        }
    }

    /**
     * @return the last seen uid, or -1 when the cursor is missing or belongs to another UIDVALIDITY
     */
    static long parseLastUid(String cursor, long uidValidity) {
        if (cursor == null || cursor.isBlank()) {
            return -1;
        }
        String[] parts = cursor.split(":");
        if (parts.length != 2) {
            return -1;
        }
        try {
            if (Long.parseLong(parts[0]) != uidValidity) {
                log.info("UIDVALIDITY changed from {} to {}, rescanning", parts[0], uidValidity);
                return -1;
            }
            return Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public void applyMutation(MessageRef ref, OperationKind kind) throws ProviderException {
        try {
            switch (kind) {
                case MARK_READ:
                case MARK_UNREAD: {
                    Located located = locate(ref, settings.getInboxFolder(), settings.getTrashFolder());
                    located.message.setFlag(Flags.Flag.SEEN, kind == OperationKind.MARK_READ);
                    break;
                }
                case TRASH:
                    move(ref, settings.getInboxFolder(), settings.getTrashFolder());
                    break;
                case RESTORE:
                    move(ref, settings.getTrashFolder(), settings.getInboxFolder());
                    break;
                case DELETE:
                case PERMANENT_DELETE: {
                    Located located = locate(ref, settings.getInboxFolder(), settings.getTrashFolder());
                    located.message.setFlag(Flags.Flag.DELETED, true);
                    located.folder.expunge();
                    break;
                }
                default:
                    throw new IllegalArgumentException("Unsupported operation: " + kind);
            }
            log.debug("Applied {} to IMAP message {}", kind, ref.getRemoteId());
        } catch (MessagingException e) {
            throw translate(kind.getWireName(), e);
        }
    }

    /**
     * Labels become IMAP keywords ({@code $AI/Work}). The inbox label is ignored, archiving
     * would need a move to a folder the account does not configure.
     */
    @Override
    public void updateLabels(MessageRef ref, Set<String> add, Set<String> remove) throws ProviderException {
        try {
            Located located = locate(ref, settings.getInboxFolder(), settings.getTrashFolder());
            Flags permanent = located.folder.getPermanentFlags();
            if (permanent == null || !permanent.contains(Flags.Flag.USER)) {
                log.debug("IMAP server of {} does not store keywords, labels stay local", account.getEmailAddress());
                return;
            }
            Flags added = keywords(add);
            if (added.getUserFlags().length > 0) {
                located.message.setFlags(added, true);
            }
            Flags removed = keywords(remove);
            if (removed.getUserFlags().length > 0) {
                located.message.setFlags(removed, false);
            }
            log.debug("Updated keywords of IMAP message {}: +{} -{}", ref.getRemoteId(), add, remove);
        } catch (MessagingException e) {
            throw translate("label update", e);
        }
    }

    private static Flags keywords(Set<String> labels) {
        Flags flags = new Flags();
        for (String label : labels) {
            if (!INBOX_LABEL.equals(label)) {
                flags.add(KEYWORD_PREFIX + label);
            }
        }
        return flags;
    }

    private void move(MessageRef ref, String from, String to) throws MessagingException, ProviderException {
        Located source = find(ref, from);
        if (source == null) {
            if (find(ref, to) != null) {
                log.debug("Message {} already in {}", ref.getRemoteId(), to);
                return;
            }
            throw new RemoteNotFoundException("Message " + ref.getRemoteId() + " not found in " + from);
        }
        source.folder.copyMessages(new Message[]{source.message}, folder(to));
        source.message.setFlag(Flags.Flag.DELETED, true);
        source.folder.expunge();
    }

    private Located locate(MessageRef ref, String... folderNames) throws MessagingException, ProviderException {
        for (String name : folderNames) {
            Located located = find(ref, name);
            if (located != null) {
                return located;
            }
        }
        throw new RemoteNotFoundException("Message " + ref.getRemoteId() + " not found in " + Arrays.toString(folderNames));
    }

    private Located find(MessageRef ref, String folderName) throws MessagingException, ProviderException {
        Folder folder = folder(folderName);
        if (folderName.equals(settings.getInboxFolder()) && ref.getRemoteId() != null) {
            try {
                Message byUid = ((UIDFolder) folder).getMessageByUID(Long.parseLong(ref.getRemoteId()));
                if (byUid != null && !byUid.isExpunged()) {
                    return new Located(folder, byUid);
                }
            } catch (NumberFormatException e) {
                log.debug("Remote id {} is not a UID", ref.getRemoteId());
            }
        }
        if (ref.getInternetMessageId() != null) {
            Message[] found = folder.search(new MessageIDTerm(ref.getInternetMessageId()));
            for (Message message : found) {
                if (!message.isExpunged()) {
                    return new Located(folder, message);
                }
            }
        }
        return null;
    }

    private Folder folder(String name) throws MessagingException, ProviderException {
        Folder folder = openFolders.get(name);
        if (folder != null && folder.isOpen()) {
            return folder;
        }
        folder = store().getFolder(name);
        folder.open(Folder.READ_WRITE);
        openFolders.put(name, folder);
        return folder;
    }

    private Store store() throws MessagingException, ProviderException {
        if (store == null) {
            try {
                store = connector.connect(settings);
            } catch (IOException e) {
                throw new ProviderAuthException("Cannot read IMAP password for " + account.getEmailAddress() + ": " + e.getMessage(), e);
            }
        }
        return store;
    }

    private ProviderException translate(String action, MessagingException e) {
        if (e instanceof AuthenticationFailedException) {
            return new ProviderAuthException("IMAP login rejected for " + account.getEmailAddress(), e);
        }
        return new TransientProviderException("IMAP " + action + " failed for " + account.getEmailAddress() + ": " + e.getMessage(), e);
    }

    @Override
    public void close() {
        for (Folder folder : openFolders.values()) {
            try {
                if (folder.isOpen()) {
                    folder.close(false);
                }
            } catch (MessagingException e) {
                log.warn("Failed to close IMAP folder {}: {}", folder.getFullName(), e.getMessage());
            }
        }
        openFolders.clear();
        if (store != null) {
            try {
                store.close();
            } catch (MessagingException e) {
                log.warn("Failed to close IMAP store for {}: {}", account.getEmailAddress(), e.getMessage());
            }
            store = null;
        }
    }

    RemoteMessage toRemoteMessage(Message message, long uid) throws MessagingException {
        String messageId = firstHeader(message, "Message-ID");
        String references = firstHeader(message, "References");
        String threadId = messageId;
        if (references != null && !references.isBlank()) {
            threadId = references.trim().split("\\s+")[0];
        }

        String[] body = new String[2];
        try {
            extractBody(message, body);
        } catch (IOException | MessagingException e) {
            log.warn("Could not read body of IMAP message {} for {}: {}", uid, account.getEmailAddress(), e.getMessage());
        }

        return RemoteMessage.builder()
                .remoteId(String.valueOf(uid))
                .internetMessageId(messageId)
                .threadId(threadId)
                .folder(axios.mail.sync.entity.Folder.INBOX)
                .from(addresses(message.getFrom()))
                .to(addresses(message.getRecipients(Message.RecipientType.TO)))
                .subject(message.getSubject())
                .sentAt(message.getSentDate() != null ? message.getSentDate().toInstant()
                        : message.getReceivedDate() != null ? message.getReceivedDate().toInstant() : null)
                .bodyText(body[0])
                .bodyHtml(body[1])
                .snippet(snippet(body[0]))
                .read(message.isSet(Flags.Flag.SEEN))
                .build();
    }

    private static String firstHeader(Message message, String name) throws MessagingException {
        String[] values = message.getHeader(name);
        return values != null && values.length > 0 ? values[0] : null;
    }

    private static String addresses(Address[] addresses) {
        return addresses == null || addresses.length == 0 ? null : InternetAddress.toString(addresses);
    }

    static String snippet(String text) {
        if (text == null) {
            return null;
        }
        String collapsed = text.replaceAll("\\s+", " ").trim();
        return collapsed.length() > SNIPPET_LENGTH ? collapsed.substring(0, SNIPPET_LENGTH) : collapsed;
    }

    // body[0] = first text/plain part, body[1] = first text/html part
    private static void extractBody(Part part, String[] body) throws MessagingException, IOException {
        if (part.isMimeType("text/plain") && body[0] == null) {
            body[0] = String.valueOf(part.getContent());
        } else if (part.isMimeType("text/html") && body[1] == null) {
            body[1] = String.valueOf(part.getContent());
        } else if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                extractBody(multipart.getBodyPart(i), body);
            }
        }
    }

    private static class Located {
        final Folder folder;
        final Message message;

        Located(Folder folder, Message message) {
            this.folder = folder;
            this.message = message;
        }
    }
}
