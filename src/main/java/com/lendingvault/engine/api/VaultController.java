package com.lendingvault.engine.api;

import com.lendingvault.engine.api.dto.DepositorRequest;
import com.lendingvault.engine.api.dto.MultiDepositRequest;
import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.model.LedgerJournalEntry;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.repository.LedgerJournalRepository;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import com.lendingvault.engine.infra.disruptor.VaultCommandService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/vault")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class VaultController {

    static final String ACCOUNT_HEADER = "X-Account";

    private final VaultCommandService commandService;
    private final TrancheLedger ledger;
    private final LedgerJournalRepository journalRepository;

    @PostMapping("/deposits")
    public ResponseEntity<Map<String, Object>> deposit(@RequestHeader(ACCOUNT_HEADER) String account,
                                                       @RequestBody DepositorRequest req) {
        TrancheId tranche = TrancheId.fromString(req.tranche());
        BigDecimal shares = commandService.deposit(account, tranche, req.amount());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "tranche", tranche,
                "shares", shares
        ));
    }

    @PostMapping("/deposits/batch")
    public ResponseEntity<Map<String, Object>> depositMany(@RequestHeader(ACCOUNT_HEADER) String account,
                                                           @RequestBody MultiDepositRequest req) {
        VaultException.require(req.amounts() != null && !req.amounts().isEmpty(),
                VaultErrorCode.INVALID_AMOUNT, "amounts missing");
        Map<TrancheId, BigDecimal> amounts = new EnumMap<>(TrancheId.class);
        req.amounts().forEach((tranche, amount) -> amounts.put(TrancheId.fromString(tranche), amount));

        Map<TrancheId, BigDecimal> shares = commandService.depositMany(account, amounts);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "shares", shares
        ));
    }

    @PostMapping("/redemptions")
    public ResponseEntity<Map<String, Object>> redeem(@RequestHeader(ACCOUNT_HEADER) String account,
                                                      @RequestBody DepositorRequest req) {
        TrancheId tranche = TrancheId.fromString(req.tranche());
        BigDecimal amount = commandService.redeem(account, tranche, req.amount());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "tranche", tranche,
                "amount", amount,
                "redemption", ledger.redemption(tranche, account)
        ));
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<Map<String, Object>> withdraw(@RequestHeader(ACCOUNT_HEADER) String account,
                                                        @RequestBody DepositorRequest req) {
        TrancheId tranche = TrancheId.fromString(req.tranche());
        BigDecimal withdrawn = req.maximum()
                ? commandService.withdrawMaximum(account, tranche)
                : commandService.withdraw(account, tranche, req.amount());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "tranche", tranche,
                "amount", withdrawn
        ));
    }

    @GetMapping("/tranches/{tranche}")
    public ResponseEntity<Map<String, Object>> tranche(@PathVariable String tranche) {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "tranche", ledger.tranche(TrancheId.fromString(tranche))
        ));
    }

    @GetMapping("/tranches/{tranche}/redemptions/{account}")
    public ResponseEntity<Map<String, Object>> redemption(@PathVariable String tranche, @PathVariable String account) {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "redemption", ledger.redemption(TrancheId.fromString(tranche), account)
        ));
    }

    @GetMapping("/balances")
    public ResponseEntity<Map<String, Object>> balances() {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "balances", ledger.balances(),
                "paused", ledger.isPaused()
        ));
    }

    @GetMapping("/journal")
    public ResponseEntity<Map<String, Object>> journal(
            @RequestParam(required = false) String account,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        int safePage = Math.max(0, page);
        int safeSize = Math.min(100, Math.max(1, size));
        PageRequest pageable = PageRequest.of(safePage, safeSize);

        Page<LedgerJournalEntry> result = account == null || account.isBlank()
                ? journalRepository.findAllByOrderBySequenceDesc(pageable)
                : journalRepository.findByAccountOrderBySequenceDesc(account, pageable);

        return ResponseEntity.ok(Map.of(
                "success", true,
                "page", safePage,
                "size", safeSize,
                "totalElements", result.getTotalElements(),
                "entries", result.getContent()
        ));
    }
}
