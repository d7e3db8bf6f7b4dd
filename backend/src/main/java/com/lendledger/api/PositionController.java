package com.lendledger.api;

import com.lendledger.api.dto.LiquidationRequest;
import com.lendledger.api.dto.PositionChangeRequest;
import com.lendledger.ledger.Position;
import com.lendledger.risk.HealthReport;
import com.lendledger.service.LendingService;
import com.lendledger.settlement.LiquidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Collateral and debt operations. The acting address comes from the X-Caller header.
 */
@RestController
@RequestMapping("/api/v1/positions")
@RequiredArgsConstructor
public class PositionController {

    private final LendingService service;

    @GetMapping
    public Position get(@RequestParam String user, @RequestParam String asset) {
        return service.getPosition(user, asset);
    }

    @GetMapping("/health")
    public HealthReport health(@RequestParam String user) {
        return service.healthFactor(user);
    }

    @PostMapping("/deposit")
    public Position deposit(@RequestHeader("X-Caller") String caller, @Validated @RequestBody PositionChangeRequest req) {
        return service.deposit(caller, req.getUser(), req.getAsset(), req.getAmount());
    }

    @PostMapping("/withdraw")
    public Position withdraw(@RequestHeader("X-Caller") String caller, @Validated @RequestBody PositionChangeRequest req) {
        return service.withdraw(caller, req.getUser(), req.getAsset(), req.getAmount());
    }

    @PostMapping("/borrow")
    public Position borrow(@RequestHeader("X-Caller") String caller, @Validated @RequestBody PositionChangeRequest req) {
        return service.borrow(caller, req.getUser(), req.getAsset(), req.getAmount());
    }

    @PostMapping("/repay")
    public Position repay(@RequestHeader("X-Caller") String caller, @Validated @RequestBody PositionChangeRequest req) {
        return service.repay(caller, req.getUser(), req.getAsset(), req.getAmount());
    }

    @PostMapping("/liquidate")
    public LiquidationResult liquidate(@RequestHeader("X-Caller") String caller, @Validated @RequestBody LiquidationRequest req) {
        return service.liquidate(caller, req.getUser(), req.getDebtAsset(), req.getDebtAmount(),
                req.getCollateralAsset(), req.getSeizeAmount());
    }
}
