package com.lendingvault.engine.api;

import com.lendingvault.engine.api.dto.AmountRequest;
import com.lendingvault.engine.api.dto.CollateralParametersRequest;
import com.lendingvault.engine.api.dto.RateCurveRequest;
import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import com.lendingvault.engine.infra.disruptor.VaultCommandService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class AdminController {

    private final VaultCommandService commandService;
    private final TrancheLedger ledger;

    @PutMapping("/utilization-model")
    public ResponseEntity<Map<String, Object>> utilizationModel(
            @RequestHeader(VaultController.ACCOUNT_HEADER) String caller,
            @RequestBody RateCurveRequest req) {
        commandService.setUtilizationModel(caller, req.toRateModel());
        return updated("utilization model updated");
    }

    @PutMapping("/collaterals/{collateralClass}")
    public ResponseEntity<Map<String, Object>> collateralParameters(
            @RequestHeader(VaultController.ACCOUNT_HEADER) String caller,
            @PathVariable String collateralClass,
            @RequestBody CollateralParametersRequest req) {
        commandService.setCollateralParameters(caller, collateralClass, req.toParameters());
        return updated("collateral parameters updated: " + collateralClass);
    }

    @PutMapping("/collaterals/{collateralClass}/value")
    public ResponseEntity<Map<String, Object>> collateralValue(
            @RequestHeader(VaultController.ACCOUNT_HEADER) String caller,
            @PathVariable String collateralClass,
            @RequestParam(required = false) String tokenId,
            @RequestBody AmountRequest req) {
        commandService.setCollateralValue(caller, collateralClass, tokenId, requireValue(req));
        return updated("collateral value updated: " + collateralClass);
    }

    @PutMapping("/senior-tranche-rate")
    public ResponseEntity<Map<String, Object>> seniorTrancheRate(
            @RequestHeader(VaultController.ACCOUNT_HEADER) String caller,
            @RequestBody AmountRequest req) {
        commandService.setSeniorTrancheRate(caller, requireValue(req));
        return updated("senior tranche rate updated");
    }

    @PutMapping("/reserve-ratio")
    public ResponseEntity<Map<String, Object>> reserveRatio(
            @RequestHeader(VaultController.ACCOUNT_HEADER) String caller,
            @RequestBody AmountRequest req) {
        commandService.setReserveRatio(caller, requireValue(req));
        return updated("reserve ratio updated");
    }

    @PutMapping("/admin-fee-rate")
    public ResponseEntity<Map<String, Object>> adminFeeRate(
            @RequestHeader(VaultController.ACCOUNT_HEADER) String caller,
            @RequestBody AmountRequest req) {
        commandService.setAdminFeeRate(caller, requireValue(req));
        return updated("admin fee rate updated");
    }

    @PutMapping("/paused")
    public ResponseEntity<Map<String, Object>> paused(
            @RequestHeader(VaultController.ACCOUNT_HEADER) String caller,
            @RequestParam boolean value) {
        commandService.setPaused(caller, value);
        return updated(value ? "vault paused" : "vault unpaused");
    }

    @PostMapping("/fees/withdraw")
    public ResponseEntity<Map<String, Object>> withdrawFees(
            @RequestHeader(VaultController.ACCOUNT_HEADER) String caller,
            @RequestBody AmountRequest req) {
        String to = req.to() == null || req.to().isBlank() ? caller : req.to();
        BigDecimal withdrawn = commandService.withdrawAdminFees(caller, to, requireValue(req));
        return ResponseEntity.ok(Map.of(
                "success", true,
                "to", to,
                "amount", withdrawn
        ));
    }

    private ResponseEntity<Map<String, Object>> updated(String message) {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", message,
                "seniorTrancheRate", ledger.seniorTrancheRate(),
                "reserveRatio", ledger.reserveRatio(),
                "adminFeeRate", ledger.adminFeeRate(),
                "paused", ledger.isPaused()
        ));
    }

    private static BigDecimal requireValue(AmountRequest req) {
        VaultException.require(req != null && req.value() != null, VaultErrorCode.INVALID_PARAMETERS, "value missing");
        return req.value();
    }
}
