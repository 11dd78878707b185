package axios.mail.sync.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.HashMap;
import java.util.Map;

/**
 * Calls an Ollama compatible {@code /api/generate} endpoint in JSON mode.
 * The request timeout lives in the {@link RestTemplate} request factory.
 */
@Slf4j
public class OllamaInferenceClient implements InferenceClient {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final double defaultTemperature;

    public OllamaInferenceClient(RestTemplate restTemplate, String endpoint, String model, double defaultTemperature) {
        this.restTemplate = restTemplate;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.model = model;
        this.defaultTemperature = defaultTemperature;
    }

    @Override
    public String complete(InferenceRequest request) {
        Map<String, Object> options = new HashMap<>();
        options.put("temperature", request.getTemperature() != null ? request.getTemperature() : defaultTemperature);
        if (request.getMaxTokens() != null) {
            options.put("num_predict", request.getMaxTokens());
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("prompt", request.getPrompt());
        body.put("format", "json");
        body.put("stream", false);
        // unload the model after the request to free VRAM
        body.put("keep_alive", 0);
        body.put("options", options);

        String raw;
        try {
            raw = restTemplate.postForObject(endpoint + "/api/generate", body, String.class);
        } catch (ResourceAccessException e) {
            boolean timeout = e.getCause() instanceof SocketTimeoutException;
            throw new InferenceException((timeout ? "Inference request timed out: " : "Inference endpoint unreachable: ")
                    + e.getMessage(), e, timeout);
        } catch (RestClientException e) {
            throw new InferenceException("Inference request failed: " + e.getMessage(), e);
        }

        if (raw == null || raw.isBlank()) {
            throw new InferenceException("Empty response from inference endpoint");
        }
        try {
            JsonNode json = objectMapper.readTree(raw);
            JsonNode response = json.get("response");
            if (response == null || response.asText().isBlank()) {
                throw new InferenceException("Inference response has no 'response' field");
            }
            return response.asText();
        } catch (JsonProcessingException e) {
            throw new InferenceException("Unreadable inference response: " + e.getOriginalMessage(), e);
        }
    }
}
