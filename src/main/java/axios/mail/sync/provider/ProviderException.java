package axios.mail.sync.provider;

/**
 * Base of the failures a {@link MailProvider} reports. Subclasses tell the caller
 * whether to retry next cycle, give up on the account, or treat the call as done.
 */
public abstract class ProviderException extends Exception {
    protected ProviderException(String message) {
        super(message);
    }

    protected ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
