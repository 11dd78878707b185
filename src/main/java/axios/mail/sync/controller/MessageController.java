package axios.mail.sync.controller;

import axios.mail.sync.ai.ClassificationGate;
import axios.mail.sync.ai.ReplySuggestionService;
import axios.mail.sync.entity.Folder;
import axios.mail.sync.entity.MailMessage;
import axios.mail.sync.entity.OperationKind;
import axios.mail.sync.entity.PendingOperation;
import axios.mail.sync.repository.MailMessageRepository;
import axios.mail.sync.service.PendingOperationService;
import jakarta.persistence.EntityNotFoundException;
import lombok.Data;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Message actions for the UI. Mutations update the local store, queue the remote change and return at once.
 */
@RestController
@RequestMapping("/api/messages")
public class MessageController {
    private final PendingOperationService pendingOperationService;
    private final ReplySuggestionService replySuggestionService;
    private final ClassificationGate classificationGate;
    private final MailMessageRepository mailMessageRepository;

    public MessageController(
            PendingOperationService pendingOperationService,
            ReplySuggestionService replySuggestionService,
            ClassificationGate classificationGate,
            MailMessageRepository mailMessageRepository) {
        this.pendingOperationService = pendingOperationService;
        this.replySuggestionService = replySuggestionService;
        this.classificationGate = classificationGate;
        this.mailMessageRepository = mailMessageRepository;
    }

    @Data
    public static class ReadRequest {
        private boolean unread;
    }

    @Data
    public static class TagsRequest {
        private Set<String> tags;
    }

    @GetMapping
    public List<MailMessage> listMessages(@RequestParam String accountId,
                                          @RequestParam(defaultValue = "INBOX") Folder folder) {
        return mailMessageRepository.findByAccountIdAndFolder(accountId, folder);
    }

    @GetMapping("/{id}")
    public MailMessage getMessage(@PathVariable String id) {
        return mailMessageRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Message not found: " + id));
    }

    @PostMapping("/{id}/read")
    public ResponseEntity<PendingOperation> markRead(@PathVariable String id, @RequestBody(required = false) ReadRequest request) {
        boolean unread = request != null && request.isUnread();
        return ResponseEntity.accepted()
                .body(pendingOperationService.requestMutation(id, unread ? OperationKind.MARK_UNREAD : OperationKind.MARK_READ));
    }

    @PostMapping("/{id}/trash")
    public ResponseEntity<PendingOperation> trash(@PathVariable String id) {
        return ResponseEntity.accepted().body(pendingOperationService.requestMutation(id, OperationKind.TRASH));
    }

    @PostMapping("/{id}/restore")
    public ResponseEntity<PendingOperation> restore(@PathVariable String id) {
        return ResponseEntity.accepted().body(pendingOperationService.requestMutation(id, OperationKind.RESTORE));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<PendingOperation> delete(@PathVariable String id,
                                                   @RequestParam(defaultValue = "false") boolean permanent) {
        OperationKind kind = permanent ? OperationKind.PERMANENT_DELETE : OperationKind.DELETE;
        return ResponseEntity.accepted().body(pendingOperationService.requestMutation(id, kind));
    }

    @PutMapping("/{id}/tags")
    public MailMessage setTags(@PathVariable String id, @RequestBody TagsRequest request) {
        if (request.getTags() == null || request.getTags().isEmpty()) {
            throw new IllegalArgumentException("At least one tag is required");
        }
        return classificationGate.tagManually(id, request.getTags());
    }

    @GetMapping("/{id}/smart-replies")
    public Map<String, List<String>> smartReplies(@PathVariable String id) {
        return Collections.singletonMap("replies", replySuggestionService.suggestReplies(id));
    }
}
