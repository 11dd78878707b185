package axios.mail.sync.provider;

/**
 * Network failure, rate limit or server error. Safe to retry on the next sync cycle.
 */
public class TransientProviderException extends ProviderException {
    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
