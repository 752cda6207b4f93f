package com.scosim.simulator.service.event;

import com.scosim.simulator.model.EventKind;
import com.scosim.simulator.model.dto.EventBody;
import com.scosim.simulator.model.dto.ItemAddedBody;
import com.scosim.simulator.model.dto.ItemRemovedBody;
import com.scosim.simulator.model.dto.ScanCompletedBody;
import com.scosim.simulator.model.dto.ScanStartedBody;
import com.scosim.simulator.model.dto.StateChangeBody;
import com.scosim.simulator.model.dto.TransactionCompletedBody;
import com.scosim.simulator.model.dto.TransactionStartedBody;
import com.scosim.simulator.model.dto.WeighingMismatchBody;

/**
 * Builds the request body for each event kind.
 * A transaction-started event rotates the active transaction before its own body is built.
 */
public class EventBodyFactory {

    private final TransactionTracker transactions;

    public EventBodyFactory(TransactionTracker transactions) {
        this.transactions = transactions;
    }

    public EventBody create(EventKind kind, long timestamp) {
        return switch (kind) {
            case TRANSACTION_STARTED -> TransactionStartedBody.builder()
                    .transactionId(transactions.rotate())
                    .timestamp(timestamp).serverTimestamp(timestamp)
                    .build();
            case TRANSACTION_COMPLETED -> TransactionCompletedBody.builder()
                    .transactionId(transactions.current())
                    .timestamp(timestamp).serverTimestamp(timestamp)
                    .build();
            case ITEM_ADDED -> ItemAddedBody.builder()
                    .transactionId(transactions.current())
                    .timestamp(timestamp).serverTimestamp(timestamp)
                    .build();
            case ITEM_REMOVED -> ItemRemovedBody.builder()
                    .transactionId(transactions.current())
                    .timestamp(timestamp).serverTimestamp(timestamp)
                    .build();
            case STATE_CHANGE -> StateChangeBody.builder()
                    .transactionId(transactions.current())
                    .timestamp(timestamp).serverTimestamp(timestamp)
                    .build();
            case SCAN_STARTED -> ScanStartedBody.builder()
                    .transactionId(transactions.current())
                    .timestamp(timestamp).serverTimestamp(timestamp)
                    .build();
            case SCAN_COMPLETED -> ScanCompletedBody.builder()
                    .transactionId(transactions.current())
                    .timestamp(timestamp).serverTimestamp(timestamp)
                    .build();
            case WEIGHING_MISMATCH -> WeighingMismatchBody.builder()
                    .transactionId(transactions.current())
                    .timestamp(timestamp).serverTimestamp(timestamp)
                    .build();
        };
    }
}
