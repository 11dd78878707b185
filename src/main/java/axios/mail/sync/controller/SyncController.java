package axios.mail.sync.controller;

import axios.mail.sync.entity.MailAccount;
import axios.mail.sync.service.AccountService;
import axios.mail.sync.service.SyncOrchestrator;
import axios.mail.sync.service.SyncResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-demand sync trigger. The cycle runs in the background, the response only says whether it started.
 */
@RestController
@RequestMapping("/api/sync")
public class SyncController {
    private final SyncOrchestrator syncOrchestrator;
    private final AccountService accountService;

    public SyncController(SyncOrchestrator syncOrchestrator, AccountService accountService) {
        this.syncOrchestrator = syncOrchestrator;
        this.accountService = accountService;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> triggerSync(@RequestParam(required = false) String accountId) {
        Map<String, String> status = new LinkedHashMap<>();
        if (accountId != null) {
            accountService.getAccount(accountId);
            status.put(accountId, syncOrchestrator.requestSync(accountId) ? "started" : "coalesced");
        } else {
            for (MailAccount account : accountService.listAccounts()) {
                if (account.isEnabled()) {
                    status.put(account.getId(), syncOrchestrator.requestSync(account.getId()) ? "started" : "coalesced");
                }
            }
        }
        return ResponseEntity.accepted().body(status);
    }

    @GetMapping("/status")
    public Map<String, SyncResult> status() {
        return syncOrchestrator.getLastResults();
    }
}
