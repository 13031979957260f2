package de.alive.mailsync.exception;

/**
 * Failure of the persistence layer. Unlike per-message mail errors this aborts the whole batch.
 */
public class SyncStoreException extends Exception {

    private final Operation operation;

    public enum Operation {
        CLAIM_ACCOUNTS,
        RELEASE_ACCOUNT,
        PERSIST_LIST,
        CLAIM_MESSAGES,
        UPDATE_STATUS,
        SAVE_CONTENT,
        FORWARD_QUEUE
    }

    public SyncStoreException(String message, Operation operation, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public SyncStoreException(String message, Operation operation) {
        super(message);
        this.operation = operation;
    }

    public Operation getOperation() {
        return operation;
    }

    @Override
    public String toString() {
        return String.format("SyncStoreException{operation=%s, message='%s'}", operation, getMessage());
    }
}
