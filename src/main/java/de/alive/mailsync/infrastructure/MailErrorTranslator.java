package de.alive.mailsync.infrastructure;

import com.sun.mail.iap.BadCommandException;
import com.sun.mail.iap.CommandFailedException;
import com.sun.mail.iap.ConnectionException;
import com.sun.mail.iap.ProtocolException;
import com.sun.mail.iap.Response;
import com.sun.mail.smtp.SMTPAddressFailedException;
import com.sun.mail.smtp.SMTPSendFailedException;
import com.sun.mail.util.FolderClosedIOException;
import com.sun.mail.util.MailConnectException;
import com.sun.mail.util.MessageRemovedIOException;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.exception.MailOperationException.Reason;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import javax.mail.AuthenticationFailedException;
import javax.mail.FolderClosedException;
import javax.mail.FolderNotFoundException;
import javax.mail.MessageRemovedException;
import javax.mail.MessagingException;
import javax.mail.SendFailedException;
import javax.mail.StoreClosedException;
import javax.mail.internet.AddressException;
import javax.mail.internet.ParseException;
import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns a {@link Reason} to failures raised by JavaMail, the IMAP protocol layer and the socket layer.
 * <p>
 * Classification looks at exception types and at RFC 5530 response codes, never at free-form message text.
 * The cause chain is walked outermost first, so a specific wrapper wins over the generic cause it carries.
 */
public final class MailErrorTranslator {

    private static final Set<String> TRANSIENT_RESPONSE_CODES = Set.of("UNAVAILABLE", "INUSE", "LIMIT", "SERVERBUG");
    private static final Set<String> AUTH_RESPONSE_CODES = Set.of("AUTHENTICATIONFAILED", "AUTHORIZATIONFAILED", "EXPIRED");
    private static final Set<String> MISSING_RESPONSE_CODES = Set.of("NONEXISTENT", "TRYCREATE");

    private MailErrorTranslator() {
    }

    @NotNull
    public static MailOperationException translate(@NotNull String operation, @NotNull Throwable error) {
        if (error instanceof MailOperationException mailError) {
            return mailError;
        }
        Reason reason = classify(error);
        return new MailOperationException(operation + " failed: " + describe(error), reason, error);
    }

    @NotNull
    public static Reason classify(@NotNull Throwable error) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        Reason fallback = null;
        Throwable current = error;

        while (current != null && seen.put(current, Boolean.TRUE) == null) {
            Optional<Reason> specific = classifySingle(current);
            if (specific.isPresent()) {
                return specific.get();
            }
            if (fallback == null && current instanceof IOException) {
                fallback = Reason.NETWORK;
            }
            current = next(current);
        }
        return fallback != null ? fallback : Reason.UNKNOWN;
    }

    private static Optional<Reason> classifySingle(Throwable error) {
        if (error instanceof MailOperationException mailError) return Optional.of(mailError.getReason());
        if (error instanceof InterruptedException) return Optional.of(Reason.INTERRUPTED);

        // message level
        if (error instanceof MessageRemovedException || error instanceof MessageRemovedIOException) {
            return Optional.of(Reason.EXPUNGED);
        }
        if (error instanceof FolderNotFoundException) return Optional.of(Reason.NOT_FOUND);
        if (error instanceof AuthenticationFailedException) return Optional.of(Reason.AUTHENTICATION);
        if (error instanceof AddressException || error instanceof ParseException) {
            return Optional.of(Reason.MALFORMED_MESSAGE);
        }

        // session and transport level
        if (error instanceof IllegalStateException) return Optional.of(Reason.PROTOCOL_SEQUENCE);
        if (error instanceof IllegalArgumentException) return Optional.of(Reason.INVALID_ARGUMENT);
        if (error instanceof FolderClosedException || error instanceof FolderClosedIOException
                || error instanceof StoreClosedException) {
            return Optional.of(Reason.NETWORK);
        }
        if (error instanceof MailConnectException || error instanceof ConnectionException) {
            return Optional.of(Reason.NETWORK);
        }
        if (error instanceof SocketTimeoutException) return Optional.of(Reason.TIMEOUT);
        if (error instanceof UnknownHostException || error instanceof SocketException) {
            return Optional.of(Reason.NETWORK);
        }

        // protocol level
        if (error instanceof BadCommandException) return Optional.of(Reason.PROTOCOL_SEQUENCE);
        if (error instanceof CommandFailedException failed) return Optional.of(classifyNo(failed));

        // smtp
        if (error instanceof SMTPSendFailedException smtp) return Optional.of(classifySmtpCode(smtp.getReturnCode()));
        if (error instanceof SMTPAddressFailedException smtp) return Optional.of(classifySmtpCode(smtp.getReturnCode()));
        if (error instanceof SendFailedException sendFailed && sendFailed.getInvalidAddresses() != null
                && sendFailed.getInvalidAddresses().length > 0) {
            return Optional.of(Reason.INVALID_ARGUMENT);
        }
        return Optional.empty();
    }

    private static Reason classifyNo(CommandFailedException failed) {
        String code = responseCode(failed);
        if (code == null) return Reason.UNKNOWN;
        if (TRANSIENT_RESPONSE_CODES.contains(code)) return Reason.SERVER_UNAVAILABLE;
        if (AUTH_RESPONSE_CODES.contains(code)) return Reason.AUTHENTICATION;
        if (MISSING_RESPONSE_CODES.contains(code)) return Reason.NOT_FOUND;
        if ("CANNOT".equals(code) || "CLIENTBUG".equals(code)) return Reason.INVALID_ARGUMENT;
        return Reason.UNKNOWN;
    }

    private static Reason classifySmtpCode(int returnCode) {
        if (returnCode >= 400 && returnCode < 500) return Reason.SERVER_UNAVAILABLE;
        if (returnCode == 530 || returnCode == 535) return Reason.AUTHENTICATION;
        return Reason.INVALID_ARGUMENT;
    }

    /**
     * Extracts the bracketed response code, e.g. {@code UNAVAILABLE} from {@code NO [UNAVAILABLE] try later}.
     */
    @Nullable
    static String responseCode(ProtocolException error) {
        Response response = error.getResponse();
        if (response == null) return null;
        return parseResponseCode(response.getRest());
    }

    @Nullable
    static String parseResponseCode(@Nullable String responseText) {
        if (responseText == null) return null;
        String text = responseText.trim();
        if (!text.startsWith("[")) return null;
        int end = text.indexOf(']');
        if (end <= 1) return null;
        String code = text.substring(1, end).trim();
        int space = code.indexOf(' ');
        if (space > 0) code = code.substring(0, space);
        return code.toUpperCase(Locale.ROOT);
    }

    @Nullable
    private static Throwable next(Throwable error) {
        if (error instanceof MessagingException messaging && messaging.getNextException() != null) {
            return messaging.getNextException();
        }
        return error.getCause();
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : message;
    }
}
