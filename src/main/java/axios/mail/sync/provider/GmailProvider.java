package axios.mail.sync.provider;

import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.OperationKind;
import axios.mail.sync.service.TokenRefreshService;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.History;
import com.google.api.services.gmail.model.HistoryLabelAdded;
import com.google.api.services.gmail.model.HistoryLabelRemoved;
import com.google.api.services.gmail.model.HistoryMessageAdded;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListLabelsResponse;
import com.google.api.services.gmail.model.ListHistoryResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gmail adapter. Folders are derived from labels, the sync cursor is the Gmail historyId.
 */
@Slf4j
public class GmailProvider implements MailProvider {
    private static final String USER_ID = "me";
    private static final String FULL_FETCH_QUERY = "in:all -in:draft -in:spam";
    private static final List<String> HISTORY_TYPES = Arrays.asList("messageAdded", "labelAdded", "labelRemoved");

    private final MailAccount account;
    private final GmailClientFactory clientFactory;
    private final TokenRefreshService tokenRefreshService;
    private final int maxMessages;

    private Gmail gmail;
    // label name to id, loaded on first label update
    private Map<String, String> labelIds;

    public GmailProvider(MailAccount account, GmailClientFactory clientFactory,
                         TokenRefreshService tokenRefreshService, int maxMessages) {
        this.account = account;
        this.clientFactory = clientFactory;
        this.tokenRefreshService = tokenRefreshService;
        this.maxMessages = maxMessages;
    }

    @Override
    public FetchResult fetchChanges(String cursor) throws ProviderException {
        if (cursor == null || cursor.isBlank()) {
            return fullFetch();
        }

        BigInteger startHistoryId;
        try {
            startHistoryId = new BigInteger(cursor);
        } catch (NumberFormatException e) {
            log.warn("Invalid history cursor '{}' for account {}, doing a full fetch", cursor, account.getEmailAddress());
            return fullFetch();
        }

        Set<String> changedIds = new LinkedHashSet<>();
        String newCursor = cursor;
        String pageToken = null;
        boolean truncated = false;
        try {
            do {
                final String currentPage = pageToken;
                ListHistoryResponse response = call(g -> g.users().history().list(USER_ID)
                        .setStartHistoryId(startHistoryId)
                        .setHistoryTypes(HISTORY_TYPES)
                        .setPageToken(currentPage)
                        .execute());
                if (response.getHistory() != null) {
                    for (History history : response.getHistory()) {
                        collectChangedIds(history, changedIds);
                        if (history.getId() != null) {
                            newCursor = history.getId().toString();
                        }
                        if (changedIds.size() >= maxMessages) {
                            truncated = true;
                            break;
                        }
                    }
                }
                pageToken = response.getNextPageToken();
                // the mailbox history id is only safe once every page has been consumed
                if (!truncated && pageToken == null && response.getHistoryId() != null) {
                    newCursor = response.getHistoryId().toString();
                }
            } while (!truncated && pageToken != null);
        } catch (RemoteNotFoundException e) {
            // history older than about a week is purged by Gmail
            log.warn("History {} no longer available for account {}, doing a full fetch", cursor, account.getEmailAddress());
            return fullFetch();
        }

        List<RemoteMessage> messages = new ArrayList<>();
        for (String id : changedIds) {
            RemoteMessage message = getMessage(id);
            if (message != null) {
                messages.add(message);
            }
        }
        log.info("Fetched {} changed messages for account {} since history {}", messages.size(), account.getEmailAddress(), cursor);
        return new FetchResult(messages, newCursor);
    }

    private FetchResult fullFetch() throws ProviderException {
        // cursor is taken before listing so nothing that arrives meanwhile is skipped next cycle
        BigInteger historyId = call(g -> g.users().getProfile(USER_ID).execute()).getHistoryId();

        ListMessagesResponse response = call(g -> g.users().messages().list(USER_ID)
                .setQ(FULL_FETCH_QUERY)
                .setMaxResults((long) maxMessages)
                .execute());

        List<RemoteMessage> messages = new ArrayList<>();
        if (response.getMessages() != null) {
            for (Message stub : response.getMessages()) {
                RemoteMessage message = getMessage(stub.getId());
                if (message != null) {
                    messages.add(message);
                }
            }
        }
        log.info("Full fetch returned {} messages for account {}", messages.size(), account.getEmailAddress());
        return new FetchResult(messages, historyId != null ? historyId.toString() : null);
    }

    private void collectChangedIds(History history, Set<String> ids) {
        if (history.getMessagesAdded() != null) {
            for (HistoryMessageAdded added : history.getMessagesAdded()) {
                ids.add(added.getMessage().getId());
            }
        }
        if (history.getLabelsAdded() != null) {
            for (HistoryLabelAdded added : history.getLabelsAdded()) {
                ids.add(added.getMessage().getId());
            }
        }
        if (history.getLabelsRemoved() != null) {
            for (HistoryLabelRemoved removed : history.getLabelsRemoved()) {
                ids.add(removed.getMessage().getId());
            }
        }
    }

    private RemoteMessage getMessage(String id) throws ProviderException {
        try {
            Message message = call(g -> g.users().messages().get(USER_ID, id).setFormat("full").execute());
            return toRemoteMessage(message);
        } catch (RemoteNotFoundException e) {
            log.debug("Message {} disappeared before it could be fetched", id);
            return null;
        }
    }

    @Override
    public void applyMutation(MessageRef ref, OperationKind kind) throws ProviderException {
        String id = ref.getRemoteId();
        switch (kind) {
            case MARK_READ:
                modify(id, Collections.emptyList(), Collections.singletonList("UNREAD"));
                break;
            case MARK_UNREAD:
                modify(id, Collections.singletonList("UNREAD"), Collections.emptyList());
                break;
            case TRASH:
                modify(id, Collections.singletonList("TRASH"), Collections.singletonList("INBOX"));
                break;
            case RESTORE:
                modify(id, Collections.singletonList("INBOX"), Collections.singletonList("TRASH"));
                break;
            case DELETE:
            case PERMANENT_DELETE:
                call(g -> g.users().messages().delete(USER_ID, id).execute());
                break;
            default:
                throw new IllegalArgumentException("Unsupported operation: " + kind);
        }
        log.debug("Applied {} to Gmail message {}", kind, id);
    }

    private void modify(String id, List<String> add, List<String> remove) throws ProviderException {
        ModifyMessageRequest request = new ModifyMessageRequest()
                .setAddLabelIds(add)
                .setRemoveLabelIds(remove);
        call(g -> g.users().messages().modify(USER_ID, id, request).execute());
    }

    @Override
    public void updateLabels(MessageRef ref, Set<String> add, Set<String> remove) throws ProviderException {
        Map<String, String> known = labelIds();
        List<String> addIds = new ArrayList<>();
        for (String name : add) {
            String id = known.get(name);
            if (id == null) {
                id = createLabel(name);
                known.put(name, id);
            }
            addIds.add(id);
        }
        List<String> removeIds = new ArrayList<>();
        for (String name : remove) {
            // labels that were never created cannot be on the message
            if (known.containsKey(name)) {
                removeIds.add(known.get(name));
            }
        }
        if (addIds.isEmpty() && removeIds.isEmpty()) {
            return;
        }
        modify(ref.getRemoteId(), addIds, removeIds);
        log.debug("Updated labels of Gmail message {}: +{} -{}", ref.getRemoteId(), add, remove);
    }

    private Map<String, String> labelIds() throws ProviderException {
        if (labelIds == null) {
            ListLabelsResponse response = call(g -> g.users().labels().list(USER_ID).execute());
            labelIds = new HashMap<>();
            if (response.getLabels() != null) {
                for (Label label : response.getLabels()) {
                    labelIds.put(label.getName(), label.getId());
                }
            }
        }
        return labelIds;
    }

    private String createLabel(String name) throws ProviderException {
        Label label = new Label()
                .setName(name)
                .setLabelListVisibility("labelShow")
                .setMessageListVisibility("show");
        Label created = call(g -> g.users().labels().create(USER_ID, label).execute());
        log.info("Created Gmail label {} for account {}", name, account.getEmailAddress());
        return created.getId();
    }

    @Override
    public void close() {
        gmail = null;
        labelIds = null;
    }

    @FunctionalInterface
    interface GmailCall<T> {
        T execute(Gmail gmail) throws IOException;
    }

    /**
     * Runs a Gmail request, refreshing the access token once on a 401 and mapping
     * HTTP failures onto the provider exception hierarchy.
     */
    <T> T call(GmailCall<T> request) throws ProviderException {
        try {
            return request.execute(client());
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() != 401) {
                throw translate(e);
            }
        } catch (IOException e) {
            throw new TransientProviderException("Gmail request failed: " + e.getMessage(), e);
        }

        gmail = clientFactory.create(tokenRefreshService.refreshTokenOn401(account));
        try {
            return request.execute(gmail);
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == 401) {
                throw new ProviderAuthException("Gmail rejected refreshed credentials for " + account.getEmailAddress(), e);
            }
            throw translate(e);
        } catch (IOException e) {
            throw new TransientProviderException("Gmail request failed: " + e.getMessage(), e);
        }
    }

    private ProviderException translate(GoogleJsonResponseException e) {
        switch (e.getStatusCode()) {
            case 403:
                if (e.getDetails() != null && e.getDetails().getMessage() != null
                        && e.getDetails().getMessage().toLowerCase().contains("rate")) {
                    return new TransientProviderException("Gmail rate limit: " + e.getDetails().getMessage(), e);
                }
                return new ProviderAuthException("Gmail access denied: " + e.getMessage(), e);
            case 404:
            case 410:
                return new RemoteNotFoundException("Gmail resource not found", e);
            default:
                return new TransientProviderException("Gmail returned " + e.getStatusCode() + ": " + e.getMessage(), e);
        }
    }

    private Gmail client() throws ProviderException {
        if (gmail == null) {
            gmail = clientFactory.create(tokenRefreshService.ensureValidAccessToken(account));
        }
        return gmail;
    }

    static RemoteMessage toRemoteMessage(Message message) {
        RemoteMessage.RemoteMessageBuilder builder = RemoteMessage.builder()
                .remoteId(message.getId())
                .threadId(message.getThreadId())
                .snippet(message.getSnippet());

        List<String> labels = message.getLabelIds() != null ? message.getLabelIds() : Collections.emptyList();
        builder.folder(folderFor(labels));
        builder.read(!labels.contains("UNREAD"));
        if (message.getInternalDate() != null) {
            builder.sentAt(Instant.ofEpochMilli(message.getInternalDate()));
        }

        MessagePart payload = message.getPayload();
        if (payload != null) {
            if (payload.getHeaders() != null) {
                for (MessagePartHeader header : payload.getHeaders()) {
                    switch (header.getName().toLowerCase()) {
                        case "subject":
                            builder.subject(header.getValue());
                            break;
                        case "from":
                            builder.from(header.getValue());
                            break;
                        case "to":
                            builder.to(header.getValue());
                            break;
                        case "message-id":
                            builder.internetMessageId(header.getValue());
                            break;
                        default:
                            break;
                    }
                }
            }
            BodyParts body = new BodyParts();
            extractBodyFromParts(payload, body);
            builder.bodyText(body.plainText);
            builder.bodyHtml(body.html);
        }
        return builder.build();
    }

    static Folder folderFor(List<String> labels) {
        if (labels.contains("TRASH")) {
            return Folder.TRASH;
        }
        if (labels.contains("SENT") && !labels.contains("INBOX")) {
            return Folder.SENT;
        }
        return Folder.INBOX;
    }

    private static class BodyParts {
        String html;
        String plainText;
    }

    private static void extractBodyFromParts(MessagePart part, BodyParts result) {
        String mimeType = part.getMimeType();
        if (part.getBody() != null && part.getBody().getData() != null && mimeType != null) {
            if (mimeType.equals("text/html") && result.html == null) {
                result.html = decode(part.getBody().getData());
            } else if (mimeType.equals("text/plain") && result.plainText == null) {
                result.plainText = decode(part.getBody().getData());
            }
        }
        if (part.getParts() != null) {
            for (MessagePart child : part.getParts()) {
                extractBodyFromParts(child, result);
            }
        }
    }

    private static String decode(String data) {
        try {
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // some senders produce standard Base64 without padding
            try {
                String padded = data;
                int remainder = padded.length() % 4;
                if (remainder > 0) {
                    padded += "=".repeat(4 - remainder);
                }
                return new String(Base64.getDecoder().decode(padded), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Could not decode message body part: {}", e2.getMessage());
                return null;
            }
        }
    }
}
