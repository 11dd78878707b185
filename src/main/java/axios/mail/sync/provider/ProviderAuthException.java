package axios.mail.sync.provider;

/**
 * Credentials are invalid or expired. The account is paused until the user re-authenticates.
 */
public class ProviderAuthException extends ProviderException {
    public ProviderAuthException(String message) {
        super(message);
    }

    public ProviderAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
