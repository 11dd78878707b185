package axios.mail.sync.provider;

/**
 * The message no longer exists on the provider.
 */
public class RemoteNotFoundException extends ProviderException {
    public RemoteNotFoundException(String message) {
        super(message);
    }

    public RemoteNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
