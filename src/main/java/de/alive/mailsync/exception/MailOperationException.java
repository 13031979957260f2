package de.alive.mailsync.exception;

public class MailOperationException extends Exception {

    private final Reason reason;

    public enum ErrorKind {
        /** Network hiccup or server-side throttling; retry after a pause on a fresh session. */
        TRANSIENT,
        /** The session is in the wrong protocol state; retry at once on a fresh session. */
        PROTOCOL_STATE,
        /** Retrying cannot help. */
        PERMANENT
    }

    public enum Reason {
        NETWORK(ErrorKind.TRANSIENT),
        TIMEOUT(ErrorKind.TRANSIENT),
        SERVER_UNAVAILABLE(ErrorKind.TRANSIENT),
        RETRIES_EXHAUSTED(ErrorKind.TRANSIENT),
        INTERRUPTED(ErrorKind.TRANSIENT),
        PROTOCOL_SEQUENCE(ErrorKind.PROTOCOL_STATE),
        AUTHENTICATION(ErrorKind.PERMANENT),
        NOT_FOUND(ErrorKind.PERMANENT),
        EXPUNGED(ErrorKind.PERMANENT),
        INVALID_ARGUMENT(ErrorKind.PERMANENT),
        MALFORMED_MESSAGE(ErrorKind.PERMANENT),
        UNKNOWN(ErrorKind.PERMANENT);

        private final ErrorKind kind;

        Reason(ErrorKind kind) {
            this.kind = kind;
        }

        public ErrorKind kind() {
            return kind;
        }
    }

    public MailOperationException(String message, Reason reason, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public MailOperationException(String message, Reason reason) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public ErrorKind getKind() {
        return reason.kind();
    }

    public boolean isRecoverable() {
        return reason.kind() != ErrorKind.PERMANENT;
    }

    @Override
    public String toString() {
        return String.format("MailOperationException{reason=%s, message='%s'}", reason, getMessage());
    }
}
