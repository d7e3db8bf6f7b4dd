package com.lendledger.settlement;

import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import com.lendledger.transfer.FundTransfer;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outgoing transfers of one settlement.
 *
 * Transfers are queued while state is being changed; {@link #close()} marks the end of the state
 * changes, and only then {@link #issue(FundTransfer)} may run. Issuing an open plan fails with
 * INTERACTION_BEFORE_EFFECTS, and so does queueing after close or issuing twice. Zero amounts
 * are skipped.
 */
@Slf4j
public class SettlementPlan {

    private final String operation;
    private final List<PlannedTransfer> queued = new ArrayList<>();
    private final List<PlannedTransfer> issued = new ArrayList<>();
    private boolean closed;
    private boolean issueStarted;

    public SettlementPlan(String operation) {
        this.operation = operation;
    }

    public SettlementPlan pay(String token, String to, BigInteger amount, String purpose) {
        if (closed) {
            throw LedgerException.of(ErrorCode.INTERACTION_BEFORE_EFFECTS,
                    operation + ": plan already closed, cannot queue " + purpose);
        }
        if (amount.signum() > 0) queued.add(new PlannedTransfer(token, to, amount, purpose));
        return this;
    }

    /** No more state changes after this point. */
    public SettlementPlan close() {
        closed = true;
        return this;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<PlannedTransfer> getQueued() {
        return Collections.unmodifiableList(queued);
    }

    /**
     * Issues every queued transfer in order. A false result or an exception aborts with
     * TRANSFER_FAILED; transfers issued before that are logged for reconciliation.
     * @return the issued transfers
     */
    public List<PlannedTransfer> issue(FundTransfer transfer) {
        if (!closed) {
            throw LedgerException.of(ErrorCode.INTERACTION_BEFORE_EFFECTS,
                    operation + ": transfers issued before state changes were closed");
        }
        if (issueStarted) {
            throw LedgerException.of(ErrorCode.INTERACTION_BEFORE_EFFECTS, operation + ": plan already issued");
        }
        issueStarted = true;

        for (PlannedTransfer t : queued) {
            boolean ok;
            try {
                ok = transfer.transfer(t.getToken(), t.getTo(), t.getAmount());
            } catch (RuntimeException e) {
                logFailure(t, e.toString());
                throw new LedgerException(ErrorCode.TRANSFER_FAILED,
                        operation + ": transfer to " + t.getPurpose() + " threw: " + e.getMessage(), e);
            }
            if (!ok) {
                logFailure(t, "returned false");
                throw LedgerException.of(ErrorCode.TRANSFER_FAILED,
                        operation + ": transfer to " + t.getPurpose() + " returned false");
            }
            issued.add(t);
        }
        return Collections.unmodifiableList(issued);
    }

    private void logFailure(PlannedTransfer failed, String why) {
        log.error("[settlement] {} transfer {} {} -> {} ({}) failed: {}; already issued: {}",
                operation, failed.getAmount(), failed.getToken(), failed.getTo(), failed.getPurpose(), why, issued);
    }
}
