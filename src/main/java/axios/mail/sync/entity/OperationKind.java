package axios.mail.sync.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of locally requested mutations that are propagated to the provider.
 */
public enum OperationKind {
    MARK_READ("mark_read"),
    MARK_UNREAD("mark_unread"),
    TRASH("trash"),
    RESTORE("restore"),
    DELETE("delete"),
    PERMANENT_DELETE("permanent_delete");

    private final String wireName;

    OperationKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static OperationKind fromWireName(String value) {
        for (OperationKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown operation kind: " + value);
    }

    /**
     * Delete kinds remove the message remotely and can never be cancelled by a later operation.
     */
    public boolean isDeletion() {
        return this == DELETE || this == PERMANENT_DELETE;
    }

    public boolean isReadState() {
        return this == MARK_READ || this == MARK_UNREAD;
    }

    /**
     * @return the operation that undoes this one, or null for deletions
     */
    public OperationKind opposite() {
        switch (this) {
            case MARK_READ:
                return MARK_UNREAD;
            case MARK_UNREAD:
                return MARK_READ;
            case TRASH:
                return RESTORE;
            case RESTORE:
                return TRASH;
            default:
                return null;
        }
    }
}
