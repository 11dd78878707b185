package axios.mail.sync.ai;

/**
 * Text completion endpoint used for classification and reply suggestions.
 * Implementations enforce their own request timeout.
 */
public interface InferenceClient {
    /**
     * Run a prompt that asks for a JSON object.
     * @param request Prompt and sampling options
     * @return The raw JSON text produced by the model
     * @throws InferenceException on timeout, transport errors or an empty response
     */
    String complete(InferenceRequest request);
}
