package de.alive.mailsync.infrastructure;

import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.exception.MailOperationException;
import org.jetbrains.annotations.NotNull;

public interface MailSessionFactory {

    @NotNull MailSession open(@NotNull MailAccount account) throws MailOperationException;
}
