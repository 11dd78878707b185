package axios.mail.sync.controller;

import axios.mail.sync.entity.OperationStatus;
import axios.mail.sync.entity.PendingOperation;
import axios.mail.sync.service.PendingOperationService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Queue status for the UI. Failed operations stay visible here until retried.
 */
@RestController
@RequestMapping("/api/operations")
public class OperationController {
    private final PendingOperationService pendingOperationService;

    public OperationController(PendingOperationService pendingOperationService) {
        this.pendingOperationService = pendingOperationService;
    }

    @GetMapping
    public List<PendingOperation> listOperations(@RequestParam(required = false) String accountId,
                                                 @RequestParam(required = false) OperationStatus status) {
        return pendingOperationService.listOperations(accountId, status);
    }

    @PostMapping("/{id}/retry")
    public PendingOperation retry(@PathVariable Long id) {
        return pendingOperationService.retryFailed(id);
    }
}
