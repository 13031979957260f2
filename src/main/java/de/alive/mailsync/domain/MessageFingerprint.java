package de.alive.mailsync.domain;

/**
 * Identity of a message within an account. UIDs are only unique per mailbox, so the pair is the key.
 */
public record MessageFingerprint(long accountId, long uid) implements Comparable<MessageFingerprint> {

    public MessageFingerprint {
        if (uid <= 0) {
            throw new IllegalArgumentException("UID must be positive: " + uid);
        }
    }

    @Override
    public int compareTo(MessageFingerprint other) {
        int byAccount = Long.compare(accountId, other.accountId);
        return byAccount != 0 ? byAccount : Long.compare(uid, other.uid);
    }

    @Override
    public String toString() {
        return accountId + "/" + uid;
    }
}
