package com.lendingvault.engine.infra.disruptor.handler;

import com.lendingvault.engine.domain.model.VaultSnapshot;
import com.lendingvault.engine.infra.disruptor.event.LedgerResultEvent;
import com.lmax.disruptor.EventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes the post-commit vault snapshot to STOMP subscribers. Only the last snapshot of a
 * batch is sent since it supersedes the earlier ones.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerBroadcastHandler implements EventHandler<LedgerResultEvent> {

    public static final String VAULT_TOPIC = "/topic/vault";
    public static final String LOAN_TOPIC_PREFIX = "/topic/loans/";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onEvent(LedgerResultEvent event, long sequence, boolean endOfBatch) {
        if (event.getCommand() != null && event.getCommand().loanKey() != null) {
            String destination = LOAN_TOPIC_PREFIX + event.getCommand().loanKey();
            messagingTemplate.convertAndSend(destination, event.getCommand());
        }

        VaultSnapshot snapshot = event.getSnapshot();
        if (!endOfBatch || snapshot == null) {
            return;
        }
        messagingTemplate.convertAndSend(VAULT_TOPIC, snapshot);

        log.debug("[Broadcast] {} → seq={}, cash={}, loans={}",
                VAULT_TOPIC, event.getCommandSequence(),
                snapshot.balances().totalCashBalance().toPlainString(),
                snapshot.balances().totalLoanBalance().toPlainString());
    }
}
