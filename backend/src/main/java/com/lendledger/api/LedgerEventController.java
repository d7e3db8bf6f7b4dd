package com.lendledger.api;

import com.lendledger.model.LedgerEventDocument;
import com.lendledger.repo.LedgerEventRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Read-only access to the recorded ledger events.
 */
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
public class LedgerEventController {

    private final LedgerEventRepo repo;

    /** Time range (inclusive, ISO-8601 instants), optionally filtered by event type. */
    @GetMapping
    public List<LedgerEventDocument> range(
            @RequestParam(required = false) String type,
            @RequestParam Instant from,
            @RequestParam Instant to
    ) {
        if (type == null || type.isBlank()) return repo.findByTsBetweenOrderByTsAsc(from, to);
        return repo.findByTypeAndTsBetweenOrderByTsAsc(type.toUpperCase(Locale.ROOT), from, to);
    }

    @GetMapping("/user/{user}")
    public List<LedgerEventDocument> byUser(@PathVariable String user) {
        return repo.findTop100ByUserOrderByTsDesc(user.toLowerCase(Locale.ROOT));
    }

    /** Latest degradation signals of an asset. */
    @GetMapping("/degradations")
    public List<LedgerEventDocument> degradations(@RequestParam String asset) {
        return repo.findTop100ByAssetAndTypeOrderByTsDesc(asset.toLowerCase(Locale.ROOT), "DEGRADATION_TRIGGERED");
    }

    @GetMapping("/guarantee/{id}")
    public List<LedgerEventDocument> byGuarantee(@PathVariable long id) {
        return repo.findByGuaranteeIdOrderByTsAsc(id);
    }
}
