package com.lendledger.guarantee;

import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import com.lendledger.math.FixedPointMath;
import com.lendledger.tx.OperationBoundary;
import com.lendledger.tx.StateJournal;
import com.lendledger.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Guarantee records with an active index per (borrower, asset) and a per-borrower list of
 * active ids. Terminated records stay readable through {@link #get(long)} and
 * {@link #findLatest(String, String)}.
 */
@Slf4j
public class GuaranteeStore {

    public static final int MAX_TERM_DAYS = 3650;

    private record Key(String borrower, String asset) {}

    private final OperationBoundary boundary;
    private final Clock clock;

    private final Map<Long, GuaranteeRecord> records = new ConcurrentHashMap<>();
    private final Map<Key, Long> activeIds = new ConcurrentHashMap<>();
    private final Map<Key, Long> latestIds = new ConcurrentHashMap<>();
    private final Map<String, Set<Long>> activeByBorrower = new ConcurrentHashMap<>();
    private volatile long nextId;

    public GuaranteeStore(OperationBoundary boundary, Clock clock) {
        this(boundary, clock, 1L);
    }

    GuaranteeStore(OperationBoundary boundary, Clock clock, long firstId) {
        this.boundary = boundary;
        this.clock = clock;
        this.nextId = firstId;
    }

    /**
     * Validates and stores a new LOCKED record.
     * @return the assigned id
     */
    public long lock(String borrower, String lender, String asset,
                     BigInteger principal, BigInteger promisedInterest,
                     int termDays, int earlyRepayPenaltyDays) {
        return boundary.execute("guaranteeLock", () -> {
            String b = AddressUtil.requireNonZero(borrower, "borrower");
            String l = AddressUtil.requireNonZero(lender, "lender");
            String a = AddressUtil.requireNonZero(asset, "asset");
            if (b.equals(l)) throw LedgerException.of(ErrorCode.BORROWER_IS_LENDER, "borrower cannot be lender");
            FixedPointMath.requirePositive(principal, "principal");
            FixedPointMath.requireUint(promisedInterest, "promisedInterest");
            if (promisedInterest.compareTo(FixedPointMath.mul(principal, BigInteger.TWO)) > 0) {
                throw LedgerException.of(ErrorCode.INTEREST_TOO_HIGH,
                        "promisedInterest " + promisedInterest + " exceeds 2 x principal " + principal);
            }
            if (termDays <= 0 || termDays > MAX_TERM_DAYS) {
                throw LedgerException.of(ErrorCode.TERM_OUT_OF_RANGE,
                        "termDays must be in (0, " + MAX_TERM_DAYS + "]: " + termDays);
            }
            if (earlyRepayPenaltyDays < 0) {
                throw LedgerException.of(ErrorCode.INVALID_CONFIG, "earlyRepayPenaltyDays is negative: " + earlyRepayPenaltyDays);
            }
            Key key = new Key(b, a);
            if (activeIds.containsKey(key)) {
                throw LedgerException.of(ErrorCode.GUARANTEE_ALREADY_ACTIVE,
                        "borrower " + b + " already has active guarantee " + activeIds.get(key) + " for " + a);
            }
            if (nextId == Long.MAX_VALUE) {
                throw LedgerException.of(ErrorCode.GUARANTEE_ID_EXHAUSTED, "guarantee id counter saturated");
            }

            long id = nextId;
            StateJournal journal = boundary.journal();
            nextId = id + 1;
            journal.recordUndo(() -> nextId = id);

            long now = clock.instant().getEpochSecond();
            GuaranteeRecord rec = GuaranteeRecord.builder()
                    .id(id).borrower(b).lender(l).asset(a)
                    .principal(principal).promisedInterest(promisedInterest)
                    .startTime(now)
                    .maturityTime(now + termDays * FixedPointMath.SECONDS_PER_DAY)
                    .earlyRepayPenaltyDays(earlyRepayPenaltyDays)
                    .status(GuaranteeStatus.LOCKED)
                    .build();
            journal.write(records, id, rec);
            journal.write(activeIds, key, id);
            journal.write(latestIds, key, id);
            setActive(b, id, true);
            log.info("[guarantee] locked id={} borrower={} lender={} asset={} principal={} term={}d", id, b, l, a, principal, termDays);
            return id;
        });
    }

    /**
     * Moves an active record to a terminal status and drops it from the active indexes.
     * The single allowed transition; a second call fails with GUARANTEE_NOT_ACTIVE.
     */
    public GuaranteeRecord markTerminal(long id, GuaranteeStatus outcome) {
        return boundary.execute("guaranteeMarkTerminal", () -> {
            if (outcome == null || !outcome.isTerminal()) {
                throw LedgerException.of(ErrorCode.INVALID_CONFIG, "not a terminal outcome: " + outcome);
            }
            GuaranteeRecord rec = get(id);
            if (!rec.isActive()) {
                throw LedgerException.of(ErrorCode.GUARANTEE_NOT_ACTIVE, "guarantee " + id + " is " + rec.getStatus());
            }
            GuaranteeRecord closed = rec.withStatus(outcome);
            StateJournal journal = boundary.journal();
            journal.write(records, id, closed);
            journal.write(activeIds, new Key(rec.getBorrower(), rec.getAsset()), null);
            setActive(rec.getBorrower(), id, false);
            return closed;
        });
    }

    // ----- reads -----

    public GuaranteeRecord get(long id) {
        GuaranteeRecord rec = boundary.read(() -> records.get(id));
        if (rec == null) throw LedgerException.of(ErrorCode.GUARANTEE_NOT_FOUND, "no guarantee with id " + id);
        return rec;
    }

    public Optional<GuaranteeRecord> findActive(String borrower, String asset) {
        Key k = key(borrower, asset);
        return boundary.read(() -> Optional.ofNullable(activeIds.get(k)).map(records::get));
    }

    /** Most recent record for the pair, terminated or not. */
    public Optional<GuaranteeRecord> findLatest(String borrower, String asset) {
        Key k = key(borrower, asset);
        return boundary.read(() -> Optional.ofNullable(latestIds.get(k)).map(records::get));
    }

    public boolean hasActiveGuarantee(String borrower, String asset) {
        Key k = key(borrower, asset);
        return boundary.read(() -> activeIds.containsKey(k));
    }

    /** Active id for the pair, 0 when there is none. */
    public long getActiveGuaranteeId(String borrower, String asset) {
        Key k = key(borrower, asset);
        return boundary.read(() -> activeIds.getOrDefault(k, 0L));
    }

    public List<Long> getActiveGuaranteeIds(String borrower) {
        String b = AddressUtil.requireNonZero(borrower, "borrower");
        return boundary.read(() -> new ArrayList<>(activeByBorrower.getOrDefault(b, Set.of())));
    }

    private Key key(String borrower, String asset) {
        return new Key(AddressUtil.requireNonZero(borrower, "borrower"), AddressUtil.requireNonZero(asset, "asset"));
    }

    private void setActive(String borrower, long id, boolean active) {
        Set<Long> next = new TreeSet<>(activeByBorrower.getOrDefault(borrower, Set.of()));
        if (active) next.add(id); else next.remove(id);
        boundary.journal().write(activeByBorrower, borrower, next.isEmpty() ? null : Collections.unmodifiableSet(next));
    }
}
