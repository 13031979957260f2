package de.alive.mailsync.domain;

public enum ForwardStatus {
    PENDING(-1),
    PROCESSING(0),
    SENT(1);

    private final int code;

    ForwardStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
