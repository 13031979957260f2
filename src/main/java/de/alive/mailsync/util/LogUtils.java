package de.alive.mailsync.util;

import java.time.Duration;

public final class LogUtils {
    public static final String SUCCESS_EMOJI = "✅";
    public static final String ERROR_EMOJI = "❌";
    public static final String WARNING_EMOJI = "⚠️";
    public static final String INFO_EMOJI = "ℹ️";
    public static final String SEARCH_EMOJI = "🔍";
    public static final String EMAIL_EMOJI = "📧";
    public static final String PROCESS_EMOJI = "⚙️";
    public static final String STOP_EMOJI = "🛑";
    public static final String HEARTBEAT_EMOJI = "💓";
    public static final String ROCKET_EMOJI = "🚀";
    public static final String RETRY_EMOJI = "🔁";
    public static final String LOCK_EMOJI = "🔒";
    public static final String CLOCK_EMOJI = "⏰";
    public static final String CHART_EMOJI = "📊";
    public static final String UPLOAD_EMOJI = "📤";

    private LogUtils() {
    }

    public static String maskEmail(String email) {
        if (email == null || !email.contains("@")) return "***";

        int at = email.indexOf('@');
        String username = email.substring(0, at);
        String domain = email.substring(at + 1);

        if (username.length() <= 2) {
            return "***@" + domain;
        }
        return username.substring(0, 2) + "***@" + domain;
    }

    public static String formatDuration(Duration duration) {
        return formatDuration(duration.toMillis(), false);
    }

    public static String formatDuration(long durationMs, boolean precise) {
        long seconds = durationMs / 1000;
        long minutes = seconds / 60;
        long hours = minutes / 60;

        if (hours > 0) return String.format("%dh %dm %ds", hours, minutes % 60, seconds % 60);
        if (minutes > 0) return String.format("%dm %ds", minutes, seconds % 60);
        if (precise && seconds < 10) return String.format("%.2fs", durationMs / 1000.0);
        return String.format("%ds", seconds);
    }

    public static String formatOutcome(int succeeded, int failed) {
        int total = succeeded + failed;
        if (total == 0) return "nothing to do";
        double failureRate = (failed * 100.0) / total;
        return String.format("%d ok, %d failed (%.1f%% failure rate)", succeeded, failed, failureRate);
    }
}
