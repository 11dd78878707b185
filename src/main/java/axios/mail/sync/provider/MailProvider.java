package axios.mail.sync.provider;

import axios.mail.sync.entity.OperationKind;

import java.util.Set;

/**
 * Remote side of one mail account. Instances are bound to a single account by
 * {@link MailProviderFactory} and live for one sync cycle. Implementations only
 * talk to the provider, they never write to the local mailbox store.
 */
public interface MailProvider extends AutoCloseable {
    /**
     * Fetch messages changed since the given cursor.
     * @param cursor Opaque position returned by a previous fetch, null for an initial fetch
     * @return Changed messages and the cursor to store once they are merged
     * @throws TransientProviderException on network or rate limit problems
     * @throws ProviderAuthException if the account credentials are rejected
     */
    FetchResult fetchChanges(String cursor) throws ProviderException;

    /**
     * Apply a queued mutation on the provider.
     * @param ref Remote identity of the target message
     * @param kind Mutation to apply
     * @throws RemoteNotFoundException if the message is already gone remotely
     * @throws TransientProviderException on network or rate limit problems
     * @throws ProviderAuthException if the account credentials are rejected
     */
    void applyMutation(MessageRef ref, OperationKind kind) throws ProviderException;

    /**
     * Label name that keeps a message in the inbox; removing it archives the message.
     */
    String INBOX_LABEL = "INBOX";

    /**
     * Add and remove classification labels on a message. Label names are provider neutral
     * ({@code AI/Work}, {@code AI/ToDo}, {@link #INBOX_LABEL}), each provider maps them onto
     * its own labels or keywords and may ignore what it cannot represent.
     * @throws RemoteNotFoundException if the message is gone remotely
     * @throws TransientProviderException on network or rate limit problems
     * @throws ProviderAuthException if the account credentials are rejected
     */
    void updateLabels(MessageRef ref, Set<String> add, Set<String> remove) throws ProviderException;

    @Override
    void close();
}
