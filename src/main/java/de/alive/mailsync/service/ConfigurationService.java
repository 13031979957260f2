package de.alive.mailsync.service;

import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.domain.MailServerSettings;
import de.alive.mailsync.exception.ConfigurationException;
import de.alive.mailsync.service.config.SyncConfiguration;
import de.alive.mailsync.util.LogUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Reads engine settings and the bootstrap account from environment variables.
 */
@Slf4j
public class ConfigurationService {

    static final String EMAIL_ENV = "EMAIL";
    static final String PASSWORD_ENV = "APP_PASSWORD";
    static final String IMAP_HOST_ENV = "IMAP_HOST";
    static final String IMAP_PORT_ENV = "IMAP_PORT";
    static final String SMTP_HOST_ENV = "SMTP_HOST";
    static final String SMTP_PORT_ENV = "SMTP_PORT";

    static final String MAX_WORKERS_ENV = "MAILSYNC_MAX_WORKERS";
    static final String SYNC_LIMIT_ENV = "MAILSYNC_SYNC_LIMIT";
    static final String WORKER_TIMEOUT_ENV = "MAILSYNC_WORKER_TIMEOUT_MINUTES";
    static final String SHARD_ENV = "MAILSYNC_SHARD";
    static final String TRIGGER_INTERVAL_ENV = "MAILSYNC_TRIGGER_INTERVAL_SECONDS";
    static final String ATTACHMENT_DIR_ENV = "MAILSYNC_ATTACHMENT_DIR";

    private static final String DEFAULT_IMAP_HOST = "imap.gmail.com";
    private static final String DEFAULT_SMTP_HOST = "smtp.gmail.com";
    private static final Duration DEFAULT_TRIGGER_INTERVAL = Duration.ofMinutes(5);

    private final Map<String, String> environment;

    public ConfigurationService() {
        this(System.getenv());
    }

    public ConfigurationService(Map<String, String> environment) {
        this.environment = environment;
    }

    public SyncConfiguration loadSyncConfiguration() {
        SyncConfiguration.SyncConfigurationBuilder builder = SyncConfiguration.forProduction().toBuilder();
        getInt(MAX_WORKERS_ENV).ifPresent(builder::maxConcurrentWorkers);
        getInt(SYNC_LIMIT_ENV).ifPresent(builder::defaultSyncLimit);
        getInt(WORKER_TIMEOUT_ENV).ifPresent(minutes -> builder.workerTimeout(Duration.ofMinutes(minutes)));

        SyncConfiguration configuration = builder.build();
        configuration.validate();
        log.info("{} Sync configuration: {}", LogUtils.PROCESS_EMOJI, configuration.getSummary());
        return configuration;
    }

    public MailAccount loadBootstrapAccount() {
        log.info("{} Loading account configuration...", LogUtils.PROCESS_EMOJI);

        String email = getRequired(EMAIL_ENV);
        String password = getRequired(PASSWORD_ENV);
        if (!email.contains("@") || !email.contains(".")) {
            throw new ConfigurationException(
                    String.format("Invalid email format: %s", LogUtils.maskEmail(email)),
                    EMAIL_ENV, ConfigurationException.ConfigurationType.INVALID_VALUE);
        }

        String imapHost = get(IMAP_HOST_ENV).orElse(DEFAULT_IMAP_HOST);
        int imapPort = getInt(IMAP_PORT_ENV).orElse(MailServerSettings.DEFAULT_IMAPS_PORT);
        String smtpHost = get(SMTP_HOST_ENV).orElse(DEFAULT_SMTP_HOST);
        int smtpPort = getInt(SMTP_PORT_ENV).orElse(MailServerSettings.DEFAULT_SUBMISSION_PORT);
        boolean implicitTls = imapPort == MailServerSettings.DEFAULT_IMAPS_PORT;

        MailServerSettings server = new MailServerSettings(imapHost, imapPort, smtpHost, smtpPort, implicitTls, true);
        MailAccount account = MailAccount.of(1L, email, password, server).withShard(getInt(SHARD_ENV).orElse(null));

        log.info("{} Account configuration loaded for {} ({}:{})", LogUtils.SUCCESS_EMOJI,
                LogUtils.maskEmail(email), imapHost, imapPort);
        return account;
    }

    public Optional<Integer> shard() {
        return getInt(SHARD_ENV);
    }

    public Duration triggerInterval() {
        return getInt(TRIGGER_INTERVAL_ENV).map(seconds -> Duration.ofSeconds(seconds)).orElse(DEFAULT_TRIGGER_INTERVAL);
    }

    public Path attachmentDirectory() {
        return Path.of(get(ATTACHMENT_DIR_ENV).orElse("attachments"));
    }

    private String getRequired(String key) {
        return get(key).orElseThrow(() -> new ConfigurationException(
                String.format("Required environment variable '%s' is not set", key),
                key, ConfigurationException.ConfigurationType.MISSING_ENVIRONMENT_VARIABLE));
    }

    private Optional<Integer> getInt(String key) {
        return get(key).map(value -> {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed <= 0) {
                    throw new NumberFormatException("not positive");
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new ConfigurationException(
                        String.format("Environment variable '%s' must be a positive integer, got '%s'", key, value),
                        key, ConfigurationException.ConfigurationType.INVALID_VALUE, e);
            }
        });
    }

    private Optional<String> get(String key) {
        return Optional.ofNullable(environment.get(key)).filter(v -> !v.trim().isEmpty());
    }
}
