package axios.mail.sync.controller;

import axios.mail.sync.entity.ImapSettings;
import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.entity.OAuthToken;
import axios.mail.sync.entity.ProviderType;
import axios.mail.sync.entity.SyncStatus;
import axios.mail.sync.service.AccountService;
import axios.mail.sync.service.ClearTrashResult;
import axios.mail.sync.service.PendingOperationService;
import axios.mail.sync.service.SyncOrchestrator;
import lombok.Data;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/accounts")
public class AccountController {
    private final AccountService accountService;
    private final PendingOperationService pendingOperationService;
    private final SyncOrchestrator syncOrchestrator;

    public AccountController(
            AccountService accountService,
            PendingOperationService pendingOperationService,
            SyncOrchestrator syncOrchestrator) {
        this.accountService = accountService;
        this.pendingOperationService = pendingOperationService;
        this.syncOrchestrator = syncOrchestrator;
    }

    /**
     * Account as shown to the UI, without credentials.
     */
    @Data
    public static class AccountView {
        private String id;
        private String emailAddress;
        private ProviderType providerType;
        private boolean enabled;
        private SyncStatus syncStatus;
        private Instant lastSyncAt;
        private String lastError;
        private boolean syncing;
    }

    @Data
    public static class RegisterRequest {
        private String emailAddress;
        private ProviderType providerType;
        private OAuthToken token;
        private ImapSettings imap;
    }

    @GetMapping
    public List<AccountView> listAccounts() {
        List<AccountView> views = new ArrayList<>();
        for (MailAccount account : accountService.listAccounts()) {
            views.add(toView(account));
        }
        return views;
    }

    @PostMapping
    public AccountView registerAccount(@RequestBody RegisterRequest request) {
        if (request.getEmailAddress() == null || request.getProviderType() == null) {
            throw new IllegalArgumentException("emailAddress and providerType are required");
        }
        return toView(accountService.registerAccount(request.getEmailAddress(), request.getProviderType(),
                request.getToken(), request.getImap()));
    }

    @PostMapping("/{id}/enable")
    public AccountView enable(@PathVariable String id) {
        return toView(accountService.setEnabled(id, true));
    }

    @PostMapping("/{id}/disable")
    public AccountView disable(@PathVariable String id) {
        return toView(accountService.setEnabled(id, false));
    }

    @PostMapping("/{id}/credentials-refreshed")
    public AccountView credentialsRefreshed(@PathVariable String id, @RequestBody(required = false) OAuthToken token) {
        MailAccount account = accountService.credentialsRefreshed(id, token);
        syncOrchestrator.requestSync(id);
        return toView(account);
    }

    @PostMapping("/{id}/clear-trash")
    public ClearTrashResult clearTrash(@PathVariable String id) {
        accountService.getAccount(id);
        return pendingOperationService.clearTrash(id);
    }

    private AccountView toView(MailAccount account) {
        AccountView view = new AccountView();
        view.setId(account.getId());
        view.setEmailAddress(account.getEmailAddress());
        view.setProviderType(account.getProviderType());
        view.setEnabled(account.isEnabled());
        view.setSyncStatus(account.getSyncStatus());
        view.setLastSyncAt(account.getLastSyncAt());
        view.setLastError(account.getLastError());
        view.setSyncing(account.getId() != null && syncOrchestrator.isRunning(account.getId()));
        return view;
    }
}
