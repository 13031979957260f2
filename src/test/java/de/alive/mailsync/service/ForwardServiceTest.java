package de.alive.mailsync.service;

import de.alive.mailsync.domain.ForwardRequest;
import de.alive.mailsync.domain.ForwardStatus;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.storage.InMemorySyncStore;
import de.alive.mailsync.support.TestAccounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ForwardServiceTest {

    @Mock
    private MailProtocolClient client;

    private InMemorySyncStore store;
    private ForwardService service;

    @BeforeEach
    void setUp() {
        store = new InMemorySyncStore();
        store.saveAccount(TestAccounts.account(1L));
        service = new ForwardService(store, client);
    }

    @Test
    @DisplayName("Sent forwards are marked SENT, failures and unknown accounts go back to PENDING")
    void testProcessPending() throws Exception {
        store.enqueueForward(ForwardRequest.pending(1L, 1L, 101L, "a@example.com, b@example.com", "fyi"));
        store.enqueueForward(ForwardRequest.pending(2L, 1L, 102L, "c@example.com", null));
        store.enqueueForward(ForwardRequest.pending(3L, 99L, 5L, "d@example.com", null));
        doThrow(new MailOperationException("relay busy", MailOperationException.Reason.SERVER_UNAVAILABLE))
                .when(client).forwardMessage(any(), eq(102L), anyList(), isNull());

        int sent = service.processPending(10);

        assertThat(sent).isEqualTo(1);
        verify(client).forwardMessage(TestAccounts.account(1L), 101L, List.of("a@example.com", "b@example.com"), "fyi");

        assertThat(store.findForward(1L)).hasValueSatisfying(request -> {
            assertThat(request.status()).isEqualTo(ForwardStatus.SENT);
            assertThat(request.result()).isEqualTo("Forwarded to a@example.com, b@example.com");
        });
        assertThat(store.findForward(2L)).hasValueSatisfying(request -> {
            assertThat(request.status()).isEqualTo(ForwardStatus.PENDING);
            assertThat(request.result()).isEqualTo("relay busy");
        });
        assertThat(store.findForward(3L)).hasValueSatisfying(request -> {
            assertThat(request.status()).isEqualTo(ForwardStatus.PENDING);
            assertThat(request.result()).isEqualTo("Unknown account 99");
        });
    }

    @Test
    @DisplayName("Empty queue does not touch the mail client")
    void testEmptyQueue() throws Exception {
        assertThat(service.processPending(10)).isZero();
        verifyNoInteractions(client);
    }
}
