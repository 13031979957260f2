package de.alive.mailsync.infrastructure;

import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.exception.MailOperationException;
import org.jetbrains.annotations.NotNull;

public interface SessionProvider {

    @NotNull MailSession acquire(@NotNull MailAccount account) throws MailOperationException;

    void release(long accountId);

    void invalidate(long accountId);
}
