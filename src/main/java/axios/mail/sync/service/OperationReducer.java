package axios.mail.sync.service;

import axios.mail.sync.entity.OperationKind;
import axios.mail.sync.entity.PendingOperation;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds the pending operations of each message into the minimal list that must reach the provider.
 * <p>
 * Operations of one message are folded left in creation order. Read state (mark_read/mark_unread)
 * and folder placement (trash/restore) are independent, so each family has its own stack of survivors:
 * <ul>
 *   <li>an operation opposite to the top survivor cancels it and is cancelled itself
 *       (mark_read/mark_unread, trash/restore);</li>
 *   <li>an operation identical to the top survivor is cancelled;</li>
 *   <li>delete and permanent_delete are never cancelled, every later operation of the message is.</li>
 * </ul>
 * Alternating chains therefore reduce pairwise: trash, restore, trash leaves the last trash.
 */
@Component
public class OperationReducer {

    @Getter
    public static class Reduction {
        private final List<PendingOperation> toExecute;
        private final List<PendingOperation> cancelled;

        Reduction(List<PendingOperation> toExecute, List<PendingOperation> cancelled) {
            this.toExecute = Collections.unmodifiableList(toExecute);
            this.cancelled = Collections.unmodifiableList(cancelled);
        }
    }

    /**
     * @param operations pending operations in processing order (createdAt, then id)
     * @return survivors in the same order, plus the operations to complete without a remote call
     */
    public Reduction reduce(List<PendingOperation> operations) {
        Map<String, List<PendingOperation>> byMessage = new LinkedHashMap<>();
        for (PendingOperation operation : operations) {
            byMessage.computeIfAbsent(operation.getMessageId(), k -> new ArrayList<>()).add(operation);
        }

        Set<PendingOperation> survivors = Collections.newSetFromMap(new IdentityHashMap<>());
        List<PendingOperation> cancelled = new ArrayList<>();
        for (List<PendingOperation> messageOperations : byMessage.values()) {
            fold(messageOperations, survivors, cancelled);
        }

        List<PendingOperation> toExecute = new ArrayList<>();
        for (PendingOperation operation : operations) {
            if (survivors.contains(operation)) {
                toExecute.add(operation);
            }
        }
        return new Reduction(toExecute, cancelled);
    }

    private void fold(List<PendingOperation> operations, Set<PendingOperation> survivors, List<PendingOperation> cancelled) {
        List<PendingOperation> readStack = new ArrayList<>();
        List<PendingOperation> folderStack = new ArrayList<>();
        PendingOperation deletion = null;
        for (PendingOperation operation : operations) {
            if (deletion != null) {
                cancelled.add(operation);
                continue;
            }
            OperationKind kind = operation.getKind();
            if (kind.isDeletion()) {
                deletion = operation;
                continue;
            }
            List<PendingOperation> stack = kind.isReadState() ? readStack : folderStack;
            PendingOperation top = stack.isEmpty() ? null : stack.get(stack.size() - 1);
            if (top != null && kind == top.getKind().opposite()) {
                stack.remove(stack.size() - 1);
                cancelled.add(top);
                cancelled.add(operation);
            } else if (top != null && kind == top.getKind()) {
                cancelled.add(operation);
            } else {
                stack.add(operation);
            }
        }
        survivors.addAll(readStack);
        survivors.addAll(folderStack);
        if (deletion != null) {
            survivors.add(deletion);
        }
    }
}
