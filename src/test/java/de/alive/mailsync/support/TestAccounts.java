package de.alive.mailsync.support;

import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.domain.MailServerSettings;

public final class TestAccounts {

    public static final MailServerSettings SERVER = MailServerSettings.imaps("imap.example.com", "smtp.example.com");

    private TestAccounts() {
    }

    public static MailAccount account(long id) {
        return MailAccount.of(id, "user" + id + "@example.com", "secret-" + id, SERVER);
    }
}
