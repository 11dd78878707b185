package axios.mail.sync.ai;

import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;

import java.net.SocketTimeoutException;
import java.util.List;

/**
 * Chat completion backend for deployments without a local model.
 */
@Slf4j
public class OpenAiInferenceClient implements InferenceClient {
    private final OpenAiService openAiService;
    private final String model;
    private final double defaultTemperature;

    public OpenAiInferenceClient(OpenAiService openAiService, String model, double defaultTemperature) {
        this.openAiService = openAiService;
        this.model = model;
        this.defaultTemperature = defaultTemperature;
    }

    @Override
    public String complete(InferenceRequest request) {
        ChatMessage message = new ChatMessage("user", request.getPrompt());
        ChatCompletionRequest.ChatCompletionRequestBuilder builder = ChatCompletionRequest.builder()
                .model(model)
                .messages(List.of(message))
                .temperature(request.getTemperature() != null ? request.getTemperature() : defaultTemperature);
        if (request.getMaxTokens() != null) {
            builder.maxTokens(request.getMaxTokens());
        }

        ChatCompletionResult result;
        try {
            result = openAiService.createChatCompletion(builder.build());
        } catch (OpenAiHttpException e) {
            throw new InferenceException("OpenAI returned " + e.statusCode + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            boolean timeout = e.getCause() instanceof SocketTimeoutException;
            throw new InferenceException("OpenAI request failed: " + e.getMessage(), e, timeout);
        }

        if (result.getChoices() == null || result.getChoices().isEmpty()
                || result.getChoices().get(0).getMessage() == null) {
            throw new InferenceException("OpenAI returned no choices");
        }
        String content = result.getChoices().get(0).getMessage().getContent();
        if (content == null || content.isBlank()) {
            throw new InferenceException("OpenAI returned an empty completion");
        }
        return stripCodeFence(content.trim());
    }

    // chat models like to wrap JSON in ```json fences
    static String stripCodeFence(String content) {
        if (!content.startsWith("```")) {
            return content;
        }
        int firstNewline = content.indexOf('\n');
        int lastFence = content.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return content;
        }
        return content.substring(firstNewline + 1, lastFence).trim();
    }
}
