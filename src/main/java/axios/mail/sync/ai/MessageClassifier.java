package axios.mail.sync.ai;

import axios.mail.sync.entity.MailMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Turns one message into a prompt, asks the model for structured tags and validates the answer.
 */
@Slf4j
@Service
public class MessageClassifier {
    public static final String TAG_IMPORTANT = "important";
    public static final String TAG_JUNK = "junk";
    public static final String TAG_NEWSLETTER = "newsletter";
    public static final String TAG_NEUTRAL = "neutral";
    public static final String TAG_SYSTEM = "system";

    static final double DEFAULT_CONFIDENCE = 0.8;

    private static final Map<String, String> TAXONOMY = new LinkedHashMap<>();

    static {
        TAXONOMY.put("work", "Work-related emails from colleagues, managers, or work tools");
        TAXONOMY.put("personal", "Personal correspondence from friends and family");
        TAXONOMY.put("finance", "Bills, transactions, statements, invoices, payment confirmations");
        TAXONOMY.put("shopping", "Receipts, order confirmations, shipping notifications");
        TAXONOMY.put("travel", "Flight confirmations, hotel bookings, itineraries");
        TAXONOMY.put("dev", "Developer notifications: GitHub, GitLab, CI/CD, code reviews");
        TAXONOMY.put("social", "Social media notifications and updates");
        TAXONOMY.put(TAG_NEWSLETTER, "Newsletters, digests, subscriptions");
        TAXONOMY.put(TAG_JUNK, "Promotional emails, spam, marketing");
        TAXONOMY.put(TAG_SYSTEM, "Automated system messages: password resets, security alerts, delivery failures");
        TAXONOMY.put(TAG_IMPORTANT, "Needs the user's attention soon");
        TAXONOMY.put(TAG_NEUTRAL, "None of the above");
    }

    private final InferenceClient inferenceClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Value("${ai.snippet-max-chars:500}")
    private int snippetMaxChars = 500;

    public MessageClassifier(InferenceClient inferenceClient) {
        this.inferenceClient = inferenceClient;
    }

    public static Set<String> taxonomy() {
        return Collections.unmodifiableSet(TAXONOMY.keySet());
    }

    /**
     * @throws InferenceException if the model cannot be reached or its answer is not usable JSON
     */
    public Classification classify(MailMessage message) {
        String raw = inferenceClient.complete(InferenceRequest.builder()
                .prompt(buildPrompt(message))
                .build());

        JsonNode json;
        try {
            json = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new InferenceException("Classification response is not JSON: " + e.getOriginalMessage(), e);
        }
        if (json == null || !json.isObject()) {
            throw new InferenceException("Classification response is not a JSON object");
        }

        String priority = "high".equalsIgnoreCase(json.path("priority").asText()) ? "high" : "normal";
        Set<String> tags = normalizeTags(json.get("tags"), priority);

        Classification classification = Classification.builder()
                .tags(tags)
                .priority(priority)
                .actionRequired(json.path("action_required").asBoolean(false))
                .canArchive(json.path("can_archive").asBoolean(false))
                .confidence(parseConfidence(json.get("confidence")))
                .build();
        log.debug("Classified message {}: tags={}, priority={}, confidence={}",
                message.getId(), tags, priority, classification.getConfidence());
        return classification;
    }

    String buildPrompt(MailMessage message) {
        StringBuilder tagDescriptions = new StringBuilder();
        for (Map.Entry<String, String> tag : TAXONOMY.entrySet()) {
            tagDescriptions.append(String.format("    - \"%s\": %s%n", tag.getKey(), tag.getValue()));
        }

        return String.format(
                "Analyze this email and classify it with structured tags.%n%n" +
                "EMAIL CONTENT:%nSubject: %s%nFrom: %s%nSnippet: %s%n%n" +
                "AVAILABLE TAGS:%n%s%n" +
                "CLASSIFICATION RULES:%n" +
                "1. Select 1-3 most relevant tags from the list above%n" +
                "2. Set priority to \"high\" if it is urgent or from an important sender%n" +
                "3. Set action_required to true if it needs a reply, a task or a payment%n" +
                "4. Set can_archive to true ONLY for receipts, shipping notifications or newsletters that need no action%n" +
                "5. Set confidence between 0.0 and 1.0%n%n" +
                "RESPOND WITH ONLY A JSON OBJECT (no markdown, no explanation):%n" +
                "{\"tags\": [\"tag1\"], \"priority\": \"high\" | \"normal\", \"action_required\": false, " +
                "\"can_archive\": false, \"confidence\": 0.85}%n",
                nullToEmpty(message.getSubject()),
                nullToEmpty(message.getFromAddress()),
                truncate(message.getSnippet() != null ? message.getSnippet() : message.getBodyText()),
                tagDescriptions);
    }

    Set<String> normalizeTags(JsonNode rawTags, String priority) {
        Set<String> tags = new LinkedHashSet<>();
        if (rawTags != null && rawTags.isArray()) {
            for (JsonNode tag : rawTags) {
                String name = tag.asText("").trim().toLowerCase();
                if (TAXONOMY.containsKey(name)) {
                    tags.add(name);
                }
            }
        } else if (rawTags != null && rawTags.isTextual()) {
            for (String name : Arrays.asList(rawTags.asText().split(","))) {
                String normalized = name.trim().toLowerCase();
                if (TAXONOMY.containsKey(normalized)) {
                    tags.add(normalized);
                }
            }
        }
        if ("high".equals(priority)) {
            tags.add(TAG_IMPORTANT);
        }
        if (tags.size() > 1) {
            tags.remove(TAG_NEUTRAL);
        }
        if (tags.isEmpty()) {
            tags.add(TAG_NEUTRAL);
        }
        return tags;
    }

    static double parseConfidence(JsonNode node) {
        if (node == null || node.isNull()) {
            return DEFAULT_CONFIDENCE;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return DEFAULT_CONFIDENCE;
            }
        }
        if (Double.isNaN(value)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > snippetMaxChars ? text.substring(0, snippetMaxChars) + "..." : text;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
