package axios.mail.sync.config;

import axios.mail.sync.ai.InferenceClient;
import axios.mail.sync.ai.OllamaInferenceClient;
import axios.mail.sync.ai.OpenAiInferenceClient;
import com.theokanning.openai.service.OpenAiService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Configuration to switch between inference backends.
 * Set ai.provider=ollama (default) or ai.provider=openai in application.properties
 */
@Configuration
public class InferenceConfig {

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "ollama", matchIfMissing = true)
    public InferenceClient ollamaInferenceClient(@Value("${ai.ollama.endpoint:http://localhost:11434}") String endpoint,
                                                 @Value("${ai.model:llama3.2}") String model,
                                                 @Value("${ai.temperature:0.3}") double temperature,
                                                 @Value("${ai.timeout-seconds:30}") int timeoutSeconds) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) Duration.ofSeconds(timeoutSeconds).toMillis());
        requestFactory.setReadTimeout((int) Duration.ofSeconds(timeoutSeconds).toMillis());
        return new OllamaInferenceClient(new RestTemplate(requestFactory), endpoint, model, temperature);
    }

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "openai")
    public InferenceClient openAiInferenceClient(@Value("${openai.api.key:}") String apiKey,
                                                 @Value("${ai.model:gpt-3.5-turbo}") String model,
                                                 @Value("${ai.temperature:0.3}") double temperature,
                                                 @Value("${ai.timeout-seconds:30}") int timeoutSeconds) {
        OpenAiService openAiService = new OpenAiService(apiKey, Duration.ofSeconds(timeoutSeconds));
        return new OpenAiInferenceClient(openAiService, model, temperature);
    }
}
