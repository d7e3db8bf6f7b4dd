package com.lendledger.tx;

import com.lendledger.event.LedgerEvent;
import com.lendledger.event.LedgerEventPublisher;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Undo log and pending-event buffer of the running operation.
 *
 * Stores call {@link #recordUndo(Runnable)} for every mutation and {@link #publish(LedgerEvent)}
 * for every domain event. Outside of an operation (no owner thread) undo actions are dropped and
 * events go straight to the publisher. Only {@link OperationBoundary} opens, commits and rolls back.
 */
@Slf4j
public class StateJournal {

    private final LedgerEventPublisher publisher;

    private final List<Runnable> undo = new ArrayList<>();
    private final List<LedgerEvent> pending = new ArrayList<>();
    private volatile Thread owner;

    public StateJournal(LedgerEventPublisher publisher) {
        this.publisher = publisher;
    }

    /** Position in the journal a nested operation can roll back to. */
    record Savepoint(int undoSize, int pendingSize) {}

    public void recordUndo(Runnable action) {
        if (owner == Thread.currentThread()) {
            undo.add(action);
        }
    }

    /**
     * Writes {@code value} under {@code key} ({@code null} removes the entry) and records the
     * inverse write.
     */
    public <K, V> void write(Map<K, V> map, K key, V value) {
        V old = value == null ? map.remove(key) : map.put(key, value);
        recordUndo(() -> {
            if (old == null) map.remove(key); else map.put(key, old);
        });
    }

    /** Buffers the event until the outermost operation commits. */
    public void publish(LedgerEvent event) {
        if (owner == Thread.currentThread()) {
            pending.add(event);
        } else {
            deliver(event);
        }
    }

    public boolean isActive() {
        return owner == Thread.currentThread();
    }

    void open() {
        owner = Thread.currentThread();
    }

    Savepoint savepoint() {
        return new Savepoint(undo.size(), pending.size());
    }

    void rollbackTo(Savepoint sp) {
        for (int i = undo.size() - 1; i >= sp.undoSize(); i--) {
            undo.remove(i).run();
        }
        while (pending.size() > sp.pendingSize()) {
            pending.remove(pending.size() - 1);
        }
    }

    /** Forget undo actions and flush pending events; closes the journal. */
    void commit() {
        undo.clear();
        List<LedgerEvent> out = new ArrayList<>(pending);
        pending.clear();
        owner = null;
        out.forEach(this::deliver);
    }

    /** Closes the journal after a rolled back outermost operation. */
    void close() {
        undo.clear();
        pending.clear();
        owner = null;
    }

    private void deliver(LedgerEvent event) {
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            // the state change is already committed; losing the signal must not undo it
            log.error("[journal] failed to publish {}: {}", event.getType(), e.toString());
        }
    }
}
