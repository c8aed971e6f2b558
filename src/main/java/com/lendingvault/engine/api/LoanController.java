package com.lendingvault.engine.api;

import com.lendingvault.engine.api.dto.AmountRequest;
import com.lendingvault.engine.api.dto.LoanRequest;
import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.model.Loan;
import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.domain.model.PurchaseResult;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.model.UpkeepTask;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import com.lendingvault.engine.domain.service.lifecycle.LoanLifecycleService;
import com.lendingvault.engine.domain.service.lifecycle.LoanUpkeepService;
import com.lendingvault.engine.infra.disruptor.VaultCommandService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/loans")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class LoanController {

    private final VaultCommandService commandService;
    private final LoanLifecycleService lifecycleService;
    private final LoanUpkeepService upkeepService;
    private final TrancheLedger ledger;

    @PostMapping("/quote")
    public ResponseEntity<Map<String, Object>> quote(@RequestBody LoanRequest req) {
        LoanKey key = keyOf(req);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "loan", key.toString(),
                "quote", lifecycleService.quote(key)
        ));
    }

    @PostMapping("/purchase")
    public ResponseEntity<Map<String, Object>> purchase(@RequestHeader(VaultController.ACCOUNT_HEADER) String seller,
                                                        @RequestBody LoanRequest req) {
        PurchaseResult result = commandService.purchase(seller, keyOf(req), minPriceOf(req));
        return ResponseEntity.ok(Map.of(
                "success", true,
                "purchase", result
        ));
    }

    @PostMapping("/purchase-and-deposit")
    public ResponseEntity<Map<String, Object>> purchaseAndDeposit(
            @RequestHeader(VaultController.ACCOUNT_HEADER) String seller,
            @RequestBody LoanRequest req) {
        VaultException.require(req.allocation() != null, VaultErrorCode.INVALID_ALLOCATION, "allocation missing");
        Map<TrancheId, BigDecimal> allocation = new EnumMap<>(TrancheId.class);
        req.allocation().forEach((tranche, fraction) -> allocation.put(TrancheId.fromString(tranche), fraction));

        PurchaseResult result = commandService.purchaseAndDeposit(seller, keyOf(req), minPriceOf(req), allocation);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "purchase", result
        ));
    }

    @PostMapping("/{platform}/{loanId}/repaid")
    public ResponseEntity<Map<String, Object>> repaid(@PathVariable String platform, @PathVariable String loanId) {
        LoanKey key = new LoanKey(platform, loanId);
        commandService.onLoanRepaid(key);
        return loanResponse(key);
    }

    @PostMapping("/{platform}/{loanId}/liquidated")
    public ResponseEntity<Map<String, Object>> liquidated(@PathVariable String platform, @PathVariable String loanId) {
        LoanKey key = new LoanKey(platform, loanId);
        commandService.onLoanLiquidated(key);
        return loanResponse(key);
    }

    @PostMapping("/{platform}/{loanId}/expired")
    public ResponseEntity<Map<String, Object>> expired(@PathVariable String platform, @PathVariable String loanId) {
        LoanKey key = new LoanKey(platform, loanId);
        commandService.onLoanExpired(key);
        return loanResponse(key);
    }

    @PostMapping("/{platform}/{loanId}/collateral/withdraw")
    public ResponseEntity<Map<String, Object>> withdrawCollateral(
            @RequestHeader(VaultController.ACCOUNT_HEADER) String caller,
            @PathVariable String platform, @PathVariable String loanId) {
        LoanKey key = new LoanKey(platform, loanId);
        commandService.withdrawCollateral(caller, key);
        return loanResponse(key);
    }

    @PostMapping("/{platform}/{loanId}/collateral/liquidated")
    public ResponseEntity<Map<String, Object>> collateralLiquidated(
            @RequestHeader(VaultController.ACCOUNT_HEADER) String caller,
            @PathVariable String platform, @PathVariable String loanId,
            @RequestBody AmountRequest req) {
        VaultException.require(req.value() != null, VaultErrorCode.INVALID_AMOUNT, "proceeds missing");
        LoanKey key = new LoanKey(platform, loanId);
        commandService.onCollateralLiquidated(caller, key, req.value());
        return loanResponse(key);
    }

    @GetMapping("/{platform}/{loanId}")
    public ResponseEntity<Map<String, Object>> loan(@PathVariable String platform, @PathVariable String loanId) {
        return loanResponse(new LoanKey(platform, loanId));
    }

    /**
     * Read-only keeper check: reports the next due resolution without performing it.
     */
    @GetMapping("/upkeep")
    public ResponseEntity<Map<String, Object>> upkeep() {
        Optional<UpkeepTask> task = upkeepService.checkUpkeep();
        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("upkeepNeeded", task.isPresent());
        task.ifPresent(t -> {
            body.put("loan", t.loanKey().toString());
            body.put("action", t.action());
        });
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<Map<String, Object>> loanResponse(LoanKey key) {
        Loan loan = ledger.loan(key)
                .orElseThrow(() -> new VaultException(VaultErrorCode.UNKNOWN_LOAN, key.toString()));
        Map<String, Object> view = new HashMap<>();
        view.put("loan", key.toString());
        view.put("collateral", loan.getCollateral().toString());
        view.put("seller", loan.getSeller());
        view.put("purchasePrice", loan.getPurchasePrice());
        view.put("repayment", loan.getRepayment());
        view.put("maturity", loan.getMaturity());
        view.put("seniorReturn", loan.getSeniorReturn());
        view.put("juniorReturn", loan.getJuniorReturn());
        view.put("adminFee", loan.getAdminFee());
        view.put("status", loan.getStatus());
        view.put("collateralWithdrawn", loan.isCollateralWithdrawn());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "loan", view
        ));
    }

    private static LoanKey keyOf(LoanRequest req) {
        VaultException.require(req.platform() != null && !req.platform().isBlank()
                        && req.loanId() != null && !req.loanId().isBlank(),
                VaultErrorCode.INVALID_PARAMETERS, "platform and loanId are required");
        return new LoanKey(req.platform(), req.loanId());
    }

    private static BigDecimal minPriceOf(LoanRequest req) {
        return req.minPurchasePrice() == null ? BigDecimal.ZERO : req.minPurchasePrice();
    }
}
