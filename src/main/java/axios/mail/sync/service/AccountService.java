package axios.mail.sync.service;

import axios.mail.sync.entity.ImapSettings;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.OAuthToken;
import axios.mail.sync.entity.ProviderType;
import axios.mail.sync.entity.SyncStatus;
import axios.mail.sync.repository.MailAccountRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Account registration and the account level switches used by the UI.
 * OAuth consent happens elsewhere, this service only receives the resulting tokens.
 */
@Slf4j
@Service
public class AccountService {
    private final MailAccountRepository mailAccountRepository;

    public AccountService(MailAccountRepository mailAccountRepository) {
        this.mailAccountRepository = mailAccountRepository;
    }

    public List<MailAccount> listAccounts() {
        return mailAccountRepository.findAll();
    }

    public MailAccount getAccount(String accountId) {
        return mailAccountRepository.findById(accountId)
                .orElseThrow(() -> new EntityNotFoundException("Account not found: " + accountId));
    }

    /**
     * Creates the account, or updates the settings of an existing account with the same address.
     */
    @Transactional
    public MailAccount registerAccount(String emailAddress, ProviderType providerType, OAuthToken token, ImapSettings imap) {
        if (providerType == ProviderType.GMAIL && (token == null || token.getRefreshToken() == null)) {
            throw new IllegalArgumentException("Gmail accounts need a refresh token");
        }
        if (providerType == ProviderType.IMAP && (imap == null || imap.getHost() == null || imap.getPasswordFile() == null)) {
            throw new IllegalArgumentException("IMAP accounts need a host and a password file");
        }

        MailAccount account = mailAccountRepository.findByEmailAddress(emailAddress).orElseGet(MailAccount::new);
        boolean created = account.getId() == null;
        account.setEmailAddress(emailAddress);
        account.setProviderType(providerType);
        account.setToken(token);
        account.setImap(imap);
        account.setSyncStatus(SyncStatus.ACTIVE);
        account.setLastError(null);
        MailAccount saved = mailAccountRepository.save(account);
        log.info("{} {} account {}", created ? "Registered" : "Updated", providerType, emailAddress);
        return saved;
    }

    @Transactional
    public MailAccount setEnabled(String accountId, boolean enabled) {
        MailAccount account = getAccount(accountId);
        account.setEnabled(enabled);
        log.info("Account {} {}", account.getEmailAddress(), enabled ? "enabled" : "disabled");
        return mailAccountRepository.save(account);
    }

    /**
     * Called after the user signed in again. Resumes syncing of an {@link SyncStatus#EXPIRED} account.
     * @param token New tokens, or null if only the IMAP password file was replaced
     */
    @Transactional
    public MailAccount credentialsRefreshed(String accountId, OAuthToken token) {
        MailAccount account = getAccount(accountId);
        if (token != null) {
            OAuthToken current = account.getToken() != null ? account.getToken() : new OAuthToken();
            current.setAccessToken(token.getAccessToken());
            current.setExpiry(token.getExpiry());
            if (token.getRefreshToken() != null) {
                current.setRefreshToken(token.getRefreshToken());
            }
            if (token.getScopes() != null) {
                current.setScopes(token.getScopes());
            }
            account.setToken(current);
        }
        account.setSyncStatus(SyncStatus.ACTIVE);
        account.setLastError(null);
        log.info("Credentials refreshed for account {}, sync resumed", account.getEmailAddress());
        return mailAccountRepository.save(account);
    }
}
