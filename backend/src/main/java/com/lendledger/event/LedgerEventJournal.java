package com.lendledger.event;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendledger.model.LedgerEventDocument;
import com.lendledger.repo.LedgerEventRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes every published ledger event to the {@code ledger_events} collection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerEventJournal {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final LedgerEventRepo repo;
    private final ObjectMapper mapper;

    @EventListener
    public void onLedgerEvent(LedgerEvent event) {
        LedgerEventDocument doc = toDocument(event);
        repo.save(doc);
        log.debug("[event-journal] stored {} user={} asset={}", doc.getType(), doc.getUser(), doc.getAsset());
    }

    LedgerEventDocument toDocument(LedgerEvent event) {
        Map<String, Object> raw = mapper.convertValue(event, MAP_REF);
        Map<String, String> payload = new LinkedHashMap<>();
        raw.forEach((k, v) -> payload.put(k, v == null ? null : String.valueOf(v)));

        Object gid = raw.get("guaranteeId");
        return LedgerEventDocument.builder()
                .type(event.getType())
                .ts(event.getOccurredAt())
                .user(firstNonNull(raw.get("user"), raw.get("borrower")))
                .asset(firstNonNull(raw.get("asset"), null))
                .guaranteeId(gid instanceof Number n ? n.longValue() : null)
                .payload(payload)
                .build();
    }

    private static String firstNonNull(Object a, Object b) {
        if (a != null) return String.valueOf(a);
        return b != null ? String.valueOf(b) : null;
    }
}
