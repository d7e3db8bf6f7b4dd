package com.lendledger.api;

import com.lendledger.api.dto.FeeSettingsRequest;
import com.lendledger.api.dto.LockGuaranteeRequest;
import com.lendledger.api.dto.RepaymentRequest;
import com.lendledger.guarantee.GuaranteeRecord;
import com.lendledger.service.LendingService;
import com.lendledger.settlement.EarlyRepaymentBreakdown;
import com.lendledger.settlement.SettlementResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

@RestController
@RequestMapping("/api/v1/guarantees")
@RequiredArgsConstructor
public class GuaranteeController {

    private final LendingService service;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public GuaranteeRecord lock(@RequestHeader("X-Caller") String caller, @Validated @RequestBody LockGuaranteeRequest req) {
        return service.lockGuarantee(caller, req.getBorrower(), req.getLender(), req.getAsset(),
                req.getPrincipal(), req.getPromisedInterest(), req.getTermDays());
    }

    @GetMapping("/{id}")
    public GuaranteeRecord get(@PathVariable long id) {
        return service.getGuarantee(id);
    }

    @GetMapping("/active")
    public List<Long> active(@RequestParam String borrower) {
        return service.getActiveGuaranteeIds(borrower);
    }

    /** What an early repayment of {@code amount} would pay out now. */
    @GetMapping("/{id}/early-repayment-preview")
    public EarlyRepaymentBreakdown preview(@PathVariable long id, @RequestParam BigInteger amount) {
        return service.previewEarlyRepayment(id, amount);
    }

    @PostMapping("/early-repayment")
    public SettlementResult earlyRepay(@RequestHeader("X-Caller") String caller, @Validated @RequestBody RepaymentRequest req) {
        return service.earlyRepay(caller, req.getBorrower(), req.getAsset(), req.getActualRepayAmount());
    }

    @PostMapping("/matured-repayment")
    public SettlementResult maturedRepay(@RequestHeader("X-Caller") String caller, @Validated @RequestBody RepaymentRequest req) {
        return service.maturedRepay(caller, req.getBorrower(), req.getAsset(), req.getActualRepayAmount());
    }

    @PostMapping("/default")
    public SettlementResult declareDefault(@RequestHeader("X-Caller") String caller, @Validated @RequestBody RepaymentRequest req) {
        return service.declareDefault(caller, req.getBorrower(), req.getAsset());
    }

    @PutMapping("/settings")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void updateSettings(@RequestHeader("X-Caller") String caller, @RequestBody FeeSettingsRequest req) {
        if (req.getPlatformFeeRateBps() != null) service.setPlatformFeeRate(caller, req.getPlatformFeeRateBps());
        if (req.getPlatformFeeReceiver() != null) service.setPlatformFeeReceiver(caller, req.getPlatformFeeReceiver());
    }
}
