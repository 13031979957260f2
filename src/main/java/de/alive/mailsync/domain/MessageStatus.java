package de.alive.mailsync.domain;

import java.util.Arrays;

/**
 * Processing state of a listed message.
 * <pre>
 * PENDING -> CLAIMED -> DONE
 *                    -> PENDING            (transient failure, deadline, store abort)
 *                    -> PERMANENT_FAILURE
 *                    -> DELETED
 * </pre>
 */
public enum MessageStatus {
    PENDING(-1),
    CLAIMED(0),
    DONE(1),
    PERMANENT_FAILURE(-2),
    DELETED(-3);

    private final int code;

    MessageStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static MessageStatus fromCode(int code) {
        return Arrays.stream(values())
                .filter(status -> status.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown message status code: " + code));
    }

    public boolean isTerminal() {
        return this == DONE || this == PERMANENT_FAILURE || this == DELETED;
    }

    public boolean canTransitionTo(MessageStatus target) {
        return switch (this) {
            case PENDING -> target == CLAIMED;
            case CLAIMED -> target != CLAIMED;
            case DONE, PERMANENT_FAILURE, DELETED -> false;
        };
    }
}
