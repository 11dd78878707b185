package axios.mail.sync.provider;

import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.OperationKind;
import axios.mail.sync.service.TokenRefreshService;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpHeaders;
import com.google.api.client.http.HttpResponseException;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.History;
import com.google.api.services.gmail.model.HistoryLabelAdded;
import com.google.api.services.gmail.model.HistoryMessageAdded;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListLabelsResponse;
import com.google.api.services.gmail.model.ListHistoryResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartBody;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GmailProviderTest {

    @Mock
    private GmailClientFactory clientFactory;

    @Mock
    private TokenRefreshService tokenRefreshService;

    @Mock
    private Gmail gmail;

    @Mock
    private Gmail refreshedGmail;

    @Mock
    private Gmail.Users users;

    @Mock
    private Gmail.Users.Messages messages;

    private MailAccount testAccount;
    private GmailProvider gmailProvider;

    @BeforeEach
    void setUp() {
        testAccount = new MailAccount();
        testAccount.setId("account123");
        testAccount.setEmailAddress("test@gmail.com");
        gmailProvider = new GmailProvider(testAccount, clientFactory, tokenRefreshService, 50);
    }

    private void clientAvailable() throws Exception {
        when(tokenRefreshService.ensureValidAccessToken(testAccount)).thenReturn("access-token");
        when(clientFactory.create("access-token")).thenReturn(gmail);
    }

    private void messagesApi() {
        when(gmail.users()).thenReturn(users);
        when(users.messages()).thenReturn(messages);
    }

    private static GoogleJsonResponseException httpError(int status, String message) {
        GoogleJsonError details = new GoogleJsonError();
        details.setCode(status);
        details.setMessage(message);
        return new GoogleJsonResponseException(
                new HttpResponseException.Builder(status, message, new HttpHeaders()), details);
    }

    private static String base64Url(String text) {
        return Base64.getUrlEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void applyMutation_MarkRead_ShouldRemoveUnreadLabel() throws Exception {
        // Given
        clientAvailable();
        messagesApi();
        Gmail.Users.Messages.Modify modify = mock(Gmail.Users.Messages.Modify.class);
        when(messages.modify(eq("me"), eq("r1"), any(ModifyMessageRequest.class))).thenReturn(modify);

        // When
        gmailProvider.applyMutation(new MessageRef("r1", null), OperationKind.MARK_READ);

        // Then
        ArgumentCaptor<ModifyMessageRequest> captor = ArgumentCaptor.forClass(ModifyMessageRequest.class);
        verify(messages).modify(eq("me"), eq("r1"), captor.capture());
        assertEquals(Collections.singletonList("UNREAD"), captor.getValue().getRemoveLabelIds());
        assertTrue(captor.getValue().getAddLabelIds().isEmpty());
        verify(modify).execute();
    }

    @Test
    void applyMutation_Trash_ShouldMoveLabelsFromInboxToTrash() throws Exception {
        // Given
        clientAvailable();
        messagesApi();
        Gmail.Users.Messages.Modify modify = mock(Gmail.Users.Messages.Modify.class);
        when(messages.modify(eq("me"), eq("r1"), any(ModifyMessageRequest.class))).thenReturn(modify);

        // When
        gmailProvider.applyMutation(new MessageRef("r1", null), OperationKind.TRASH);

        // Then
        ArgumentCaptor<ModifyMessageRequest> captor = ArgumentCaptor.forClass(ModifyMessageRequest.class);
        verify(messages).modify(eq("me"), eq("r1"), captor.capture());
        assertEquals(Collections.singletonList("TRASH"), captor.getValue().getAddLabelIds());
        assertEquals(Collections.singletonList("INBOX"), captor.getValue().getRemoveLabelIds());
    }

    @Test
    void applyMutation_PermanentDeleteOnMissingMessage_ShouldThrowNotFound() throws Exception {
        // Given
        clientAvailable();
        messagesApi();
        Gmail.Users.Messages.Delete delete = mock(Gmail.Users.Messages.Delete.class);
        when(messages.delete("me", "r1")).thenReturn(delete);
        when(delete.execute()).thenThrow(httpError(404, "Requested entity was not found."));

        // When & Then
        assertThrows(RemoteNotFoundException.class,
                () -> gmailProvider.applyMutation(new MessageRef("r1", null), OperationKind.PERMANENT_DELETE));
    }

    @Test
    void call_With401_ShouldRefreshTokenAndRetryOnce() throws Exception {
        // Given
        clientAvailable();
        when(tokenRefreshService.refreshTokenOn401(testAccount)).thenReturn("fresh-token");
        when(clientFactory.create("fresh-token")).thenReturn(refreshedGmail);
        AtomicInteger attempts = new AtomicInteger();

        // When
        String result = gmailProvider.call(g -> {
            attempts.incrementAndGet();
            if (g == gmail) {
                throw httpError(401, "Invalid Credentials");
            }
            return "ok";
        });

        // Then
        assertEquals("ok", result);
        assertEquals(2, attempts.get());
        verify(tokenRefreshService, times(1)).refreshTokenOn401(testAccount);
    }

    @Test
    void call_With401AfterRefresh_ShouldThrowAuthException() throws Exception {
        // Given
        clientAvailable();
        when(tokenRefreshService.refreshTokenOn401(testAccount)).thenReturn("fresh-token");
        when(clientFactory.create("fresh-token")).thenReturn(refreshedGmail);

        // When & Then
        assertThrows(ProviderAuthException.class, () -> gmailProvider.call(g -> {
            throw httpError(401, "Invalid Credentials");
        }));
        verify(tokenRefreshService, times(1)).refreshTokenOn401(testAccount);
    }

    @Test
    void call_WithRateLimit403_ShouldThrowTransient() throws Exception {
        // Given
        clientAvailable();

        // When & Then
        assertThrows(TransientProviderException.class, () -> gmailProvider.call(g -> {
            throw httpError(403, "User Rate Limit Exceeded");
        }));
        verify(tokenRefreshService, never()).refreshTokenOn401(any());
    }

    @Test
    void call_WithPermission403_ShouldThrowAuth() throws Exception {
        // Given
        clientAvailable();

        // When & Then
        assertThrows(ProviderAuthException.class, () -> gmailProvider.call(g -> {
            throw httpError(403, "Insufficient Permission");
        }));
    }

    @Test
    void call_WithServerErrorOrNetworkFailure_ShouldThrowTransient() throws Exception {
        // Given
        clientAvailable();

        // When & Then
        assertThrows(TransientProviderException.class, () -> gmailProvider.call(g -> {
            throw httpError(503, "Backend Error");
        }));
        assertThrows(TransientProviderException.class, () -> gmailProvider.call(g -> {
            throw new IOException("Connection reset");
        }));
    }

    @Test
    void fetchChanges_WithHistoryCursor_ShouldFetchChangedMessagesAndAdvanceCursor() throws Exception {
        // Given
        clientAvailable();
        when(gmail.users()).thenReturn(users);
        Gmail.Users.History historyApi = mock(Gmail.Users.History.class);
        Gmail.Users.History.List historyList = mock(Gmail.Users.History.List.class);
        when(users.history()).thenReturn(historyApi);
        when(historyApi.list("me")).thenReturn(historyList);
        when(historyList.setStartHistoryId(BigInteger.valueOf(1000))).thenReturn(historyList);
        when(historyList.setHistoryTypes(anyList())).thenReturn(historyList);
        when(historyList.setPageToken(any())).thenReturn(historyList);

        History added = new History().setMessagesAdded(List.of(
                new HistoryMessageAdded().setMessage(new Message().setId("r1"))));
        History labelled = new History().setLabelsAdded(List.of(
                new HistoryLabelAdded().setMessage(new Message().setId("r1"))));
        when(historyList.execute()).thenReturn(new ListHistoryResponse()
                .setHistory(Arrays.asList(added, labelled))
                .setHistoryId(BigInteger.valueOf(1050)));

        when(users.messages()).thenReturn(messages);
        Gmail.Users.Messages.Get get = mock(Gmail.Users.Messages.Get.class);
        when(messages.get("me", "r1")).thenReturn(get);
        when(get.setFormat("full")).thenReturn(get);
        when(get.execute()).thenReturn(new Message().setId("r1").setLabelIds(List.of("INBOX", "UNREAD")));

        // When
        FetchResult result = gmailProvider.fetchChanges("1000");

        // Then
        assertEquals("1050", result.getNewCursor());
        assertEquals(1, result.getMessages().size());
        assertEquals("r1", result.getMessages().get(0).getRemoteId());
        assertFalse(result.getMessages().get(0).isRead());
    }

    private Gmail.Users.History.List historyListFrom(long startHistoryId) throws Exception {
        when(gmail.users()).thenReturn(users);
        Gmail.Users.History historyApi = mock(Gmail.Users.History.class);
        Gmail.Users.History.List historyList = mock(Gmail.Users.History.List.class);
        when(users.history()).thenReturn(historyApi);
        when(historyApi.list("me")).thenReturn(historyList);
        when(historyList.setStartHistoryId(BigInteger.valueOf(startHistoryId))).thenReturn(historyList);
        when(historyList.setHistoryTypes(anyList())).thenReturn(historyList);
        when(historyList.setPageToken(any())).thenReturn(historyList);
        return historyList;
    }

    private static History addedAt(long historyId, String remoteId) {
        return new History().setId(BigInteger.valueOf(historyId)).setMessagesAdded(List.of(
                new HistoryMessageAdded().setMessage(new Message().setId(remoteId))));
    }

    private void messageAvailable(String remoteId) throws Exception {
        Gmail.Users.Messages.Get get = mock(Gmail.Users.Messages.Get.class);
        when(messages.get("me", remoteId)).thenReturn(get);
        when(get.setFormat("full")).thenReturn(get);
        when(get.execute()).thenReturn(new Message().setId(remoteId).setLabelIds(List.of("INBOX")));
    }

    @Test
    void fetchChanges_WhenLimitReachedBeforeLastPage_ShouldStopCursorAtLastConsumedRecord() throws Exception {
        // Given
        gmailProvider = new GmailProvider(testAccount, clientFactory, tokenRefreshService, 2);
        clientAvailable();
        Gmail.Users.History.List historyList = historyListFrom(1000);
        when(historyList.execute()).thenReturn(new ListHistoryResponse()
                .setHistory(Arrays.asList(addedAt(1001, "r1"), addedAt(1002, "r2"), addedAt(1003, "r3")))
                .setNextPageToken("page-2")
                .setHistoryId(BigInteger.valueOf(2000)));
        when(users.messages()).thenReturn(messages);
        messageAvailable("r1");
        messageAvailable("r2");

        // When
        FetchResult result = gmailProvider.fetchChanges("1000");

        // Then
        assertEquals("1002", result.getNewCursor());
        assertEquals(2, result.getMessages().size());
        verify(historyList, times(1)).execute();
        verify(messages, never()).get("me", "r3");
    }

    @Test
    void fetchChanges_WithSeveralPages_ShouldReadAllPagesBeforeTakingMailboxHistoryId() throws Exception {
        // Given
        clientAvailable();
        Gmail.Users.History.List historyList = historyListFrom(1000);
        when(historyList.execute()).thenReturn(
                new ListHistoryResponse()
                        .setHistory(List.of(addedAt(1001, "r1")))
                        .setNextPageToken("page-2")
                        .setHistoryId(BigInteger.valueOf(2000)),
                new ListHistoryResponse()
                        .setHistory(List.of(addedAt(1500, "r3")))
                        .setHistoryId(BigInteger.valueOf(2000)));
        when(users.messages()).thenReturn(messages);
        messageAvailable("r1");
        messageAvailable("r3");

        // When
        FetchResult result = gmailProvider.fetchChanges("1000");

        // Then
        assertEquals("2000", result.getNewCursor());
        assertEquals(2, result.getMessages().size());
        verify(historyList).setPageToken("page-2");
    }

    @Test
    void updateLabels_ShouldCreateMissingLabelsAndSkipUnknownRemovals() throws Exception {
        // Given
        clientAvailable();
        messagesApi();
        Gmail.Users.Labels labelsApi = mock(Gmail.Users.Labels.class);
        Gmail.Users.Labels.List labelList = mock(Gmail.Users.Labels.List.class);
        Gmail.Users.Labels.Create labelCreate = mock(Gmail.Users.Labels.Create.class);
        when(users.labels()).thenReturn(labelsApi);
        when(labelsApi.list("me")).thenReturn(labelList);
        when(labelList.execute()).thenReturn(new ListLabelsResponse().setLabels(Arrays.asList(
                new Label().setId("INBOX").setName("INBOX"),
                new Label().setId("Label_1").setName("AI/Work"))));
        when(labelsApi.create(eq("me"), any(Label.class))).thenReturn(labelCreate);
        when(labelCreate.execute()).thenReturn(new Label().setId("Label_2").setName("AI/ToDo"));
        Gmail.Users.Messages.Modify modify = mock(Gmail.Users.Messages.Modify.class);
        when(messages.modify(eq("me"), eq("r1"), any(ModifyMessageRequest.class))).thenReturn(modify);

        // When
        gmailProvider.updateLabels(new MessageRef("r1", null),
                new LinkedHashSet<>(Arrays.asList("AI/Work", "AI/ToDo")),
                new LinkedHashSet<>(Arrays.asList("AI/Finance", "INBOX")));

        // Then
        ArgumentCaptor<Label> created = ArgumentCaptor.forClass(Label.class);
        verify(labelsApi).create(eq("me"), created.capture());
        assertEquals("AI/ToDo", created.getValue().getName());
        ArgumentCaptor<ModifyMessageRequest> captor = ArgumentCaptor.forClass(ModifyMessageRequest.class);
        verify(messages).modify(eq("me"), eq("r1"), captor.capture());
        assertEquals(Arrays.asList("Label_1", "Label_2"), captor.getValue().getAddLabelIds());
        assertEquals(Collections.singletonList("INBOX"), captor.getValue().getRemoveLabelIds());
        verify(modify).execute();
    }

    @Test
    void updateLabels_WithOnlyUnknownRemovals_ShouldNotModifyMessage() throws Exception {
        // Given
        clientAvailable();
        when(gmail.users()).thenReturn(users);
        Gmail.Users.Labels labelsApi = mock(Gmail.Users.Labels.class);
        Gmail.Users.Labels.List labelList = mock(Gmail.Users.Labels.List.class);
        when(users.labels()).thenReturn(labelsApi);
        when(labelsApi.list("me")).thenReturn(labelList);
        when(labelList.execute()).thenReturn(new ListLabelsResponse());

        // When
        gmailProvider.updateLabels(new MessageRef("r1", null), Collections.emptySet(), Collections.singleton("AI/Finance"));

        // Then
        verify(users, never()).messages();
    }

    @Test
    void toRemoteMessage_ShouldReadHeadersLabelsAndBody() {
        // Given
        MessagePart plain = new MessagePart().setMimeType("text/plain")
                .setBody(new MessagePartBody().setData(base64Url("Hello there")));
        MessagePart html = new MessagePart().setMimeType("text/html")
                .setBody(new MessagePartBody().setData(base64Url("<p>Hello there</p>")));
        MessagePart payload = new MessagePart().setMimeType("multipart/alternative")
                .setHeaders(Arrays.asList(
                        new MessagePartHeader().setName("Subject").setValue("Greetings"),
                        new MessagePartHeader().setName("From").setValue("Alice <alice@example.com>"),
                        new MessagePartHeader().setName("Message-ID").setValue("<abc@example.com>")))
                .setParts(Arrays.asList(plain, html));
        Message message = new Message()
                .setId("r9")
                .setThreadId("t9")
                .setLabelIds(List.of("INBOX"))
                .setInternalDate(1700000000000L)
                .setPayload(payload);

        // When
        RemoteMessage remote = GmailProvider.toRemoteMessage(message);

        // Then
        assertEquals("r9", remote.getRemoteId());
        assertEquals("Greetings", remote.getSubject());
        assertEquals("Alice <alice@example.com>", remote.getFrom());
        assertEquals("<abc@example.com>", remote.getInternetMessageId());
        assertEquals("Hello there", remote.getBodyText());
        assertEquals("<p>Hello there</p>", remote.getBodyHtml());
        assertTrue(remote.isRead());
        assertEquals(Folder.INBOX, remote.getFolder());
    }

    @Test
    void folderFor_ShouldMapGmailLabels() {
        assertEquals(Folder.TRASH, GmailProvider.folderFor(List.of("TRASH", "INBOX")));
        assertEquals(Folder.SENT, GmailProvider.folderFor(List.of("SENT")));
        assertEquals(Folder.INBOX, GmailProvider.folderFor(List.of("SENT", "INBOX")));
        assertEquals(Folder.INBOX, GmailProvider.folderFor(Collections.emptyList()));
    }
}
