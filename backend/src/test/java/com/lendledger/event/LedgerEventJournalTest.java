package com.lendledger.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendledger.guarantee.GuaranteeStatus;
import com.lendledger.model.LedgerEventDocument;
import com.lendledger.repo.LedgerEventRepo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.time.Instant;

import static com.lendledger.support.TestAddresses.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class LedgerEventJournalTest {

    private static final Instant AT = Instant.parse("2025-02-10T00:00:00Z");

    private final LedgerEventRepo repo = mock(LedgerEventRepo.class);
    private final LedgerEventJournal journal = new LedgerEventJournal(repo, new ObjectMapper().findAndRegisterModules());

    @Test
    @DisplayName("stores a guarantee event under its borrower with amounts as strings")
    void guaranteeEvent() {
        journal.onLedgerEvent(GuaranteeTerminatedEvent.builder()
                .guaranteeId(3)
                .borrower(ALICE).lender(BOB).asset(USDC)
                .outcome(GuaranteeStatus.EARLY_REPAID)
                .actualInterestPaid(BigInteger.valueOf(20_000))
                .penaltyToLender(BigInteger.valueOf(1_000))
                .platformFee(BigInteger.valueOf(290))
                .refundToBorrower(BigInteger.valueOf(28_710))
                .lenderCompensation(new BigInteger("1021000"))
                .occurredAt(AT)
                .build());

        ArgumentCaptor<LedgerEventDocument> saved = ArgumentCaptor.forClass(LedgerEventDocument.class);
        verify(repo).save(saved.capture());
        LedgerEventDocument doc = saved.getValue();
        assertThat(doc.getType()).isEqualTo("GUARANTEE_TERMINATED");
        assertThat(doc.getTs()).isEqualTo(AT);
        assertThat(doc.getUser()).isEqualTo(ALICE);
        assertThat(doc.getAsset()).isEqualTo(USDC);
        assertThat(doc.getGuaranteeId()).isEqualTo(3L);
        assertThat(doc.getPayload())
                .containsEntry("outcome", "EARLY_REPAID")
                .containsEntry("lenderCompensation", "1021000")
                .containsEntry("lender", BOB);
    }

    @Test
    @DisplayName("an oracle event has an asset but no user or guarantee")
    void oracleEvent() {
        LedgerEventDocument doc = journal.toDocument(OracleHealthChangedEvent.builder()
                .asset(WETH).healthy(false).details("Price is stale").occurredAt(AT)
                .build());

        assertThat(doc.getType()).isEqualTo("ORACLE_HEALTH_CHANGED");
        assertThat(doc.getUser()).isNull();
        assertThat(doc.getAsset()).isEqualTo(WETH);
        assertThat(doc.getGuaranteeId()).isNull();
        assertThat(doc.getPayload()).containsEntry("healthy", "false");
    }
}
