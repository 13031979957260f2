package de.alive.mailsync.domain;

public record MailServerSettings(
        String imapHost,
        int imapPort,
        String smtpHost,
        int smtpPort,
        boolean implicitTls,
        boolean startTls
) {

    public static final int DEFAULT_IMAPS_PORT = 993;
    public static final int DEFAULT_SUBMISSION_PORT = 587;

    public MailServerSettings {
        if (imapHost == null || imapHost.trim().isEmpty()) {
            throw new IllegalArgumentException("IMAP host cannot be null or empty");
        }
        if (imapPort <= 0 || imapPort > 65535) {
            throw new IllegalArgumentException("IMAP port out of range: " + imapPort);
        }
        if (smtpPort < 0 || smtpPort > 65535) {
            throw new IllegalArgumentException("SMTP port out of range: " + smtpPort);
        }
    }

    public static MailServerSettings imaps(String imapHost, String smtpHost) {
        return new MailServerSettings(imapHost, DEFAULT_IMAPS_PORT, smtpHost, DEFAULT_SUBMISSION_PORT, true, true);
    }

    public String imapProtocol() {
        return implicitTls ? "imaps" : "imap";
    }

    public boolean canSend() {
        return smtpHost != null && !smtpHost.isBlank() && smtpPort > 0;
    }
}
