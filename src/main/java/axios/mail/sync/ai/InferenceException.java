package axios.mail.sync.ai;

/**
 * Inference call failed or produced an unusable answer. Never fatal to a sync cycle.
 */
public class InferenceException extends RuntimeException {
    private final boolean timeout;

    public InferenceException(String message) {
        this(message, null, false);
    }

    public InferenceException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public InferenceException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
