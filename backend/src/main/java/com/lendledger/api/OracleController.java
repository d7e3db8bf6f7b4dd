package com.lendledger.api;

import com.lendledger.service.LendingService;
import com.lendledger.valuation.OracleHealth;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only oracle probes. Never fails for a bad asset; the details say what is wrong.
 */
@RestController
@RequestMapping("/api/v1/oracle")
@RequiredArgsConstructor
public class OracleController {

    private final LendingService service;

    @GetMapping("/health")
    public OracleHealth health(@RequestParam String asset) {
        return service.checkPriceOracleHealth(asset);
    }

    @PostMapping("/health/batch")
    public List<OracleHealth> batch(@RequestBody List<String> assets) {
        return service.checkPriceOracleHealthBatch(assets);
    }
}
