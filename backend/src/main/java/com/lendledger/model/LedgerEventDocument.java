package com.lendledger.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Audit copy of a ledger event. Core state never reads these back.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("ledger_events")
public class LedgerEventDocument {

    @Id
    private String id;

    /** Event name, e.g. "GUARANTEE_TERMINATED". */
    @Indexed
    private String type;

    @Indexed
    private Instant ts;

    @Indexed
    private String user;

    @Indexed
    private String asset;

    private Long guaranteeId;

    /** All event fields as strings; uint256 values do not fit Mongo numeric types. */
    private Map<String, String> payload;
}
