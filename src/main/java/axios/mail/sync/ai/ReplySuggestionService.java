package axios.mail.sync.ai;

import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailMessage;
import axios.mail.sync.repository.MailMessageRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Short reply suggestions for a message. Any failure degrades to an empty list.
 */
@Slf4j
@Service
public class ReplySuggestionService {
    static final int MAX_REPLIES = 4;
    private static final int MAX_REPLY_LENGTH = 500;
    private static final double REPLY_TEMPERATURE = 0.7;

    private final InferenceClient inferenceClient;
    private final MailMessageRepository mailMessageRepository;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Value("${ai.snippet-max-chars:500}")
    private int snippetMaxChars = 500;

    public ReplySuggestionService(InferenceClient inferenceClient, MailMessageRepository mailMessageRepository) {
        this.inferenceClient = inferenceClient;
        this.mailMessageRepository = mailMessageRepository;
    }

    /**
     * @throws EntityNotFoundException if the message does not exist
     */
    public List<String> suggestReplies(String messageId) {
        MailMessage message = mailMessageRepository.findById(messageId)
                .orElseThrow(() -> new EntityNotFoundException("Message not found: " + messageId));

        if (message.getFolder() == Folder.SENT || message.getFolder() == Folder.DELETING
                || message.getTags().contains(MessageClassifier.TAG_JUNK)
                || message.getTags().contains(MessageClassifier.TAG_NEWSLETTER)) {
            log.debug("No reply suggestions for message {} (folder {}, tags {})", messageId, message.getFolder(), message.getTags());
            return Collections.emptyList();
        }

        try {
            String raw = inferenceClient.complete(InferenceRequest.builder()
                    .prompt(buildPrompt(message))
                    .temperature(REPLY_TEMPERATURE)
                    .build());
            List<String> replies = parseReplies(raw);
            log.info("Generated {} reply suggestions for message {}", replies.size(), messageId);
            return replies;
        } catch (InferenceException e) {
            log.warn("Reply suggestions unavailable for message {}: {}", messageId, e.getMessage());
            return Collections.emptyList();
        } catch (RuntimeException e) {
            log.error("Unexpected error generating reply suggestions for message {}: {}", messageId, e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    List<String> parseReplies(String raw) {
        JsonNode json;
        try {
            json = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Reply suggestion response is not JSON: {}", e.getOriginalMessage());
            return Collections.emptyList();
        }
        JsonNode replies = json != null ? json.get("replies") : null;
        if (replies == null || !replies.isArray()) {
            log.warn("Reply suggestion response has no replies array");
            return Collections.emptyList();
        }

        List<String> result = new ArrayList<>();
        for (JsonNode reply : replies) {
            if (!reply.isTextual() || reply.asText().isBlank()) {
                continue;
            }
            String cleaned = reply.asText().trim();
            result.add(cleaned.length() > MAX_REPLY_LENGTH ? cleaned.substring(0, MAX_REPLY_LENGTH) : cleaned);
            if (result.size() == MAX_REPLIES) {
                break;
            }
        }
        return result;
    }

    private String buildPrompt(MailMessage message) {
        String content = message.getSnippet() != null ? message.getSnippet() : message.getBodyText();
        if (content == null) {
            content = "";
        } else if (content.length() > snippetMaxChars) {
            content = content.substring(0, snippetMaxChars) + "...";
        }
        return String.format(
                "Generate 3-4 short, contextual reply suggestions for this email.%n%n" +
                "EMAIL CONTENT:%nSubject: %s%nFrom: %s%nContent: %s%n%n" +
                "GUIDELINES:%n" +
                "1. Keep each reply to 1-2 sentences maximum%n" +
                "2. Be professional but friendly%n" +
                "3. Don't include greetings or signatures%n%n" +
                "RESPOND WITH ONLY A JSON OBJECT (no markdown, no explanation):%n" +
                "{\"replies\": [\"Reply suggestion 1\", \"Reply suggestion 2\", \"Reply suggestion 3\"]}%n",
                message.getSubject() != null ? message.getSubject() : "",
                message.getFromAddress() != null ? message.getFromAddress() : "",
                content);
    }
}
