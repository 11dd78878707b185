package axios.mail.sync.service;

import axios.mail.sync.entity.ImapSettings;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.OAuthToken;
import axios.mail.sync.entity.ProviderType;
import axios.mail.sync.entity.SyncStatus;
import axios.mail.sync.repository.MailAccountRepository;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock
    private MailAccountRepository mailAccountRepository;

    private AccountService accountService;

    @BeforeEach
    void setUp() {
        accountService = new AccountService(mailAccountRepository);
    }

    @Test
    void registerAccount_GmailWithoutRefreshToken_ShouldThrowIllegalArgument() {
        // Given
        OAuthToken token = new OAuthToken();
        token.setAccessToken("access");

        // When & Then
        assertThrows(IllegalArgumentException.class,
                () -> accountService.registerAccount("test@gmail.com", ProviderType.GMAIL, token, null));
        verifyNoInteractions(mailAccountRepository);
    }

    @Test
    void registerAccount_ImapWithSettings_ShouldCreateActiveAccount() {
        // Given
        ImapSettings imap = new ImapSettings();
        imap.setHost("imap.example.com");
        imap.setUsername("user");
        imap.setPasswordFile("/run/secrets/imap");
        when(mailAccountRepository.findByEmailAddress("user@example.com")).thenReturn(Optional.empty());
        when(mailAccountRepository.save(any(MailAccount.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        MailAccount account = accountService.registerAccount("user@example.com", ProviderType.IMAP, null, imap);

        // Then
        assertEquals(ProviderType.IMAP, account.getProviderType());
        assertEquals(SyncStatus.ACTIVE, account.getSyncStatus());
        assertTrue(account.isEnabled());
        assertEquals("imap.example.com", account.getImap().getHost());
    }

    @Test
    void credentialsRefreshed_OnExpiredAccount_ShouldResumeSyncAndKeepRefreshToken() {
        // Given
        OAuthToken current = new OAuthToken();
        current.setAccessToken("old");
        current.setRefreshToken("refresh-1");
        MailAccount account = new MailAccount();
        account.setId("account123");
        account.setToken(current);
        account.setSyncStatus(SyncStatus.EXPIRED);
        account.setLastError("invalid_grant");
        when(mailAccountRepository.findById("account123")).thenReturn(Optional.of(account));
        when(mailAccountRepository.save(account)).thenReturn(account);

        OAuthToken fresh = new OAuthToken();
        fresh.setAccessToken("new");
        fresh.setExpiry(Instant.now().plusSeconds(3600));

        // When
        MailAccount result = accountService.credentialsRefreshed("account123", fresh);

        // Then
        assertEquals(SyncStatus.ACTIVE, result.getSyncStatus());
        assertNull(result.getLastError());
        assertEquals("new", result.getToken().getAccessToken());
        assertEquals("refresh-1", result.getToken().getRefreshToken());
    }

    @Test
    void setEnabled_WithUnknownAccount_ShouldThrowNotFound() {
        // Given
        when(mailAccountRepository.findById("missing")).thenReturn(Optional.empty());

        // When & Then
        assertThrows(EntityNotFoundException.class, () -> accountService.setEnabled("missing", false));
    }
}
