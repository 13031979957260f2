package de.alive.mailsync.service;

import de.alive.mailsync.domain.ForwardRequest;
import de.alive.mailsync.domain.ForwardStatus;
import de.alive.mailsync.domain.MailAccount;
import de.alive.mailsync.exception.MailOperationException;
import de.alive.mailsync.exception.SyncStoreException;
import de.alive.mailsync.storage.SyncStore;
import de.alive.mailsync.util.LogUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Works off the forward queue. A failed forward goes back to PENDING with the error as its result text.
 */
@Slf4j
public class ForwardService {

    private final SyncStore store;
    private final MailProtocolClient client;

    public ForwardService(SyncStore store, MailProtocolClient client) {
        this.store = store;
        this.client = client;
    }

    /**
     * @return number of forwards sent
     */
    public int processPending(int limit) throws SyncStoreException {
        List<ForwardRequest> claimed = store.claimPendingForwards(limit);
        if (claimed.isEmpty()) {
            return 0;
        }

        int sent = 0;
        for (ForwardRequest request : claimed) {
            if (process(request)) {
                sent++;
            }
        }
        log.info("{} Forward queue: {}", LogUtils.EMAIL_EMOJI, LogUtils.formatOutcome(sent, claimed.size() - sent));
        return sent;
    }

    private boolean process(ForwardRequest request) throws SyncStoreException {
        Optional<MailAccount> account = store.findAccount(request.accountId());
        if (account.isEmpty()) {
            store.completeForward(request.id(), ForwardStatus.PENDING, "Unknown account " + request.accountId());
            return false;
        }

        try {
            client.forwardMessage(account.get(), request.uid(), request.recipients(), request.note());
            store.completeForward(request.id(), ForwardStatus.SENT,
                    "Forwarded to " + String.join(", ", request.recipients()));
            return true;
        } catch (MailOperationException e) {
            log.warn("{} Forward {} of message {} failed ({}): {}", LogUtils.WARNING_EMOJI, request.id(),
                    request.uid(), e.getReason(), e.getMessage());
            store.completeForward(request.id(), ForwardStatus.PENDING, e.getMessage());
            return false;
        }
    }
}
