package axios.mail.sync.ai;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InferenceRequest {
    String prompt;
    // null falls back to the configured default
    Double temperature;
    Integer maxTokens;
}
