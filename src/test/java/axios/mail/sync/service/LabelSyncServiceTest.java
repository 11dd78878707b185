package axios.mail.sync.service;

import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.MailMessage;
import axios.mail.sync.provider.MailProvider;
import axios.mail.sync.provider.MessageRef;
import axios.mail.sync.provider.ProviderAuthException;
import axios.mail.sync.provider.TransientProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LabelSyncServiceTest {

    @Mock
    private MailProvider provider;

    private LabelSyncService labelSyncService;

    private MailAccount testAccount;

    @BeforeEach
    void setUp() {
        labelSyncService = new LabelSyncService();

        testAccount = new MailAccount();
        testAccount.setId("account123");
        testAccount.setEmailAddress("test@example.com");
    }

    private MailMessage classified(String id, String... tags) {
        MailMessage message = new MailMessage();
        message.setId(id);
        message.setRemoteId("r" + id);
        message.setInternetMessageId("<" + id + "@example.com>");
        message.setFolder(Folder.INBOX);
        message.setTags(new HashSet<>(Arrays.asList(tags)));
        message.setPriority("normal");
        message.setClassified(true);
        return message;
    }

    @Test
    void computeChanges_WithHighPriorityActionableWork_ShouldAddPrefixedLabels() {
        // Given
        MailMessage message = classified("1", "work");
        message.setPriority("high");
        message.setActionRequired(true);

        // When
        LabelSyncService.LabelChange change = labelSyncService.computeChanges(message);

        // Then
        assertEquals(Set.of("AI/Work", "AI/Priority", "AI/ToDo"), change.getAdd());
        assertTrue(change.getRemove().contains("AI/Finance"));
        assertTrue(change.getRemove().contains("AI/Newsletter"));
        assertFalse(change.getRemove().contains("AI/Work"));
        assertFalse(change.getRemove().contains("AI/ToDo"));
        assertFalse(change.getRemove().contains(MailProvider.INBOX_LABEL));
    }

    @Test
    void computeChanges_WithArchivableInboxMessage_ShouldRemoveInboxLabel() {
        // Given
        MailMessage message = classified("1", "newsletter");
        message.setCanArchive(true);

        // When
        LabelSyncService.LabelChange change = labelSyncService.computeChanges(message);

        // Then
        assertEquals(Set.of("AI/Newsletter"), change.getAdd());
        assertTrue(change.getRemove().contains(MailProvider.INBOX_LABEL));
        assertTrue(change.getRemove().contains("AI/Priority"));
    }

    @Test
    void computeChanges_WithArchivingDisabled_ShouldKeepInboxLabel() {
        // Given
        ReflectionTestUtils.setField(labelSyncService, "archive", false);
        MailMessage message = classified("1", "newsletter");
        message.setCanArchive(true);

        // When
        LabelSyncService.LabelChange change = labelSyncService.computeChanges(message);

        // Then
        assertFalse(change.getRemove().contains(MailProvider.INBOX_LABEL));
    }

    @Test
    void computeChanges_WithCustomPrefix_ShouldUseIt() {
        // Given
        ReflectionTestUtils.setField(labelSyncService, "prefix", "Mail");

        // When
        LabelSyncService.LabelChange change = labelSyncService.computeChanges(classified("1", "dev"));

        // Then
        assertEquals(Set.of("Mail/Dev"), change.getAdd());
    }

    @Test
    void pushLabels_WhenOneMessageFails_ShouldStillLabelTheOthers() throws Exception {
        // Given
        MailMessage first = classified("1", "work");
        MailMessage broken = classified("2", "finance");
        MailMessage third = classified("3", "travel");
        doAnswer(inv -> {
            MessageRef ref = inv.getArgument(0);
            if ("r2".equals(ref.getRemoteId())) {
                throw new TransientProviderException("rate limited");
            }
            return null;
        }).when(provider).updateLabels(any(MessageRef.class), anySet(), anySet());

        // When
        int updated = labelSyncService.pushLabels(testAccount, provider, Arrays.asList(first, broken, third));

        // Then
        assertEquals(2, updated);
        verify(provider).updateLabels(eq(new MessageRef("r1", "<1@example.com>")), eq(Set.of("AI/Work")), anySet());
        verify(provider).updateLabels(eq(new MessageRef("r3", "<3@example.com>")), eq(Set.of("AI/Travel")), anySet());
    }

    @Test
    void pushLabels_WithRejectedCredentials_ShouldStopLabelling() throws Exception {
        // Given
        doThrow(new ProviderAuthException("invalid_grant"))
                .when(provider).updateLabels(any(MessageRef.class), anySet(), anySet());

        // When
        int updated = labelSyncService.pushLabels(testAccount, provider,
                Arrays.asList(classified("1", "work"), classified("2", "work")));

        // Then
        assertEquals(0, updated);
        verify(provider, times(1)).updateLabels(any(MessageRef.class), anySet(), anySet());
    }

    @Test
    void pushLabels_ShouldSkipMessagesBeingDeletedOrWithoutRemoteId() throws Exception {
        // Given
        MailMessage deleting = classified("1", "work");
        deleting.setFolder(Folder.DELETING);
        MailMessage local = classified("2", "work");
        local.setRemoteId(null);

        // When
        int updated = labelSyncService.pushLabels(testAccount, provider, List.of(deleting, local));

        // Then
        assertEquals(0, updated);
        verifyNoInteractions(provider);
    }

    @Test
    void pushLabels_WhenDisabled_ShouldNotTouchProvider() {
        // Given
        ReflectionTestUtils.setField(labelSyncService, "enabled", false);

        // When
        int updated = labelSyncService.pushLabels(testAccount, provider, List.of(classified("1", "work")));

        // Then
        assertEquals(0, updated);
        verifyNoInteractions(provider);
        assertEquals(0, labelSyncService.pushLabels(testAccount, provider, Collections.emptyList()));
    }
}
