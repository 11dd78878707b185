package axios.mail.sync.ai;

import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailMessage;
import axios.mail.sync.repository.MailMessageRepository;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReplySuggestionServiceTest {

    @Mock
    private InferenceClient inferenceClient;

    @Mock
    private MailMessageRepository mailMessageRepository;

    private ReplySuggestionService replySuggestionService;

    private MailMessage testMessage;

    @BeforeEach
    void setUp() {
        replySuggestionService = new ReplySuggestionService(inferenceClient, mailMessageRepository);

        testMessage = new MailMessage();
        testMessage.setId("m1");
        testMessage.setFolder(Folder.INBOX);
        testMessage.setSubject("Lunch on Friday?");
        testMessage.setFromAddress("Bob <bob@example.com>");
        testMessage.setSnippet("Are you free for lunch this Friday?");
    }

    @Test
    void suggestReplies_WithValidResponse_ShouldReturnReplies() {
        // Given
        when(mailMessageRepository.findById("m1")).thenReturn(Optional.of(testMessage));
        when(inferenceClient.complete(any(InferenceRequest.class))).thenReturn(
                "{\"replies\": [\"Sounds good, see you then!\", \"  Can we do Saturday instead?  \", \"\"]}");

        // When
        List<String> replies = replySuggestionService.suggestReplies("m1");

        // Then
        assertEquals(List.of("Sounds good, see you then!", "Can we do Saturday instead?"), replies);
        ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
        verify(inferenceClient).complete(captor.capture());
        assertEquals(0.7, captor.getValue().getTemperature(), 0.0001);
        assertTrue(captor.getValue().getPrompt().contains("Lunch on Friday?"));
    }

    @Test
    void suggestReplies_WithTooManyReplies_ShouldKeepFirstFour() {
        // Given
        when(mailMessageRepository.findById("m1")).thenReturn(Optional.of(testMessage));
        when(inferenceClient.complete(any(InferenceRequest.class))).thenReturn(
                "{\"replies\": [\"a\", \"b\", \"c\", \"d\", \"e\"]}");

        // When
        List<String> replies = replySuggestionService.suggestReplies("m1");

        // Then
        assertEquals(ReplySuggestionService.MAX_REPLIES, replies.size());
        assertEquals("d", replies.get(3));
    }

    @Test
    void suggestReplies_ForNewsletter_ShouldNotCallModel() {
        // Given
        testMessage.setTags(new HashSet<>(List.of(MessageClassifier.TAG_NEWSLETTER)));
        when(mailMessageRepository.findById("m1")).thenReturn(Optional.of(testMessage));

        // When
        List<String> replies = replySuggestionService.suggestReplies("m1");

        // Then
        assertTrue(replies.isEmpty());
        verifyNoInteractions(inferenceClient);
    }

    @Test
    void suggestReplies_WhenModelTimesOut_ShouldReturnEmptyList() {
        // Given
        when(mailMessageRepository.findById("m1")).thenReturn(Optional.of(testMessage));
        when(inferenceClient.complete(any(InferenceRequest.class)))
                .thenThrow(new InferenceException("Inference request timed out", null, true));

        // When
        List<String> replies = replySuggestionService.suggestReplies("m1");

        // Then
        assertTrue(replies.isEmpty());
    }

    @Test
    void suggestReplies_WithMalformedResponse_ShouldReturnEmptyList() {
        // Given
        when(mailMessageRepository.findById("m1")).thenReturn(Optional.of(testMessage));
        when(inferenceClient.complete(any(InferenceRequest.class))).thenReturn("{\"suggestions\": \"yes\"}");

        // When & Then
        assertTrue(replySuggestionService.suggestReplies("m1").isEmpty());
    }

    @Test
    void suggestReplies_WithUnknownMessage_ShouldThrowNotFound() {
        // Given
        when(mailMessageRepository.findById("missing")).thenReturn(Optional.empty());

        // When & Then
        assertThrows(EntityNotFoundException.class, () -> replySuggestionService.suggestReplies("missing"));
    }

    @Test
    void suggestReplies_WhenBackendFailsUnexpectedly_ShouldReturnEmptyList() {
        // Given
        when(mailMessageRepository.findById("m1")).thenReturn(Optional.of(testMessage));
        when(inferenceClient.complete(any(InferenceRequest.class))).thenThrow(new IllegalStateException("connection pool shut down"));

        // When
        List<String> replies = replySuggestionService.suggestReplies("m1");

        // Then
        assertTrue(replies.isEmpty());
    }
}
