package com.lendledger.tx;

import com.lendledger.error.LedgerException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * All-or-nothing execution of top-level ledger operations.
 *
 * One fair lock serialises every operation (single logical writer). A call that re-enters from
 * the thread already inside an operation, e.g. from a transfer callback, joins it: it sees the
 * state the outer operation has written so far and gets its own savepoint, so its failure only
 * undoes its own changes. When the outermost operation fails, every change recorded in the
 * {@link StateJournal} is undone in reverse order and no buffered event is published.
 */
@Slf4j
public class OperationBoundary {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final StateJournal journal;
    private int depth;

    public OperationBoundary(StateJournal journal) {
        this.journal = journal;
    }

    public StateJournal journal() {
        return journal;
    }

    public <T> T execute(String operation, Supplier<T> body) {
        lock.lock();
        try {
            if (depth == 0) {
                journal.open();
            }
            StateJournal.Savepoint sp = journal.savepoint();
            depth++;
            try {
                T out = body.get();
                if (depth == 1) {
                    journal.commit();
                    log.debug("[boundary] {} committed", operation);
                }
                return out;
            } catch (RuntimeException | Error e) {
                journal.rollbackTo(sp);
                if (depth == 1) {
                    journal.close();
                }
                logRollback(operation, e);
                throw e;
            } finally {
                depth--;
            }
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Runs a read under the operation lock. Another thread never observes an operation that has
     * not committed yet; the thread inside one sees its own writes.
     */
    public <T> T read(Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    /** True while the current thread is inside an operation. */
    public boolean inOperation() {
        return lock.isHeldByCurrentThread();
    }

    private void logRollback(String operation, Throwable e) {
        if (e instanceof LedgerException le) {
            log.info("[boundary] {} rolled back (depth={}): {} {}", operation, depth, le.getCode(), le.getMessage());
        } else {
            log.warn("[boundary] {} rolled back (depth={}): {}", operation, depth, e.toString());
        }
    }
}
