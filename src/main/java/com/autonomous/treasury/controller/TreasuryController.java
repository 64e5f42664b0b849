package com.autonomous.treasury.controller;

import com.autonomous.treasury.model.AdminEvent;
import com.autonomous.treasury.model.AgentBudget;
import com.autonomous.treasury.model.BudgetStatus;
import com.autonomous.treasury.model.CircuitBreakerState;
import com.autonomous.treasury.model.PerformanceSnapshot;
import com.autonomous.treasury.model.RescaleResult;
import com.autonomous.treasury.model.RoiData;
import com.autonomous.treasury.model.Transaction;
import com.autonomous.treasury.model.TransactionReceipt;
import com.autonomous.treasury.model.TreasuryAnalytics;
import com.autonomous.treasury.service.AdminLogService;
import com.autonomous.treasury.service.BudgetRegistryService;
import com.autonomous.treasury.service.CircuitBreakerService;
import com.autonomous.treasury.service.PerformanceScalerService;
import com.autonomous.treasury.service.TransactionLedgerService;
import com.autonomous.treasury.service.TreasuryAnalyticsService;
import lombok.Data;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Administrative and agent-facing HTTP surface over the treasury services.
 */
@RestController
@RequestMapping("/treasury")
public class TreasuryController {

    private final BudgetRegistryService registry;
    private final TransactionLedgerService ledger;
    private final CircuitBreakerService circuitBreaker;
    private final PerformanceScalerService scaler;
    private final TreasuryAnalyticsService analytics;
    private final AdminLogService adminLog;

    public TreasuryController(BudgetRegistryService registry, TransactionLedgerService ledger,
                              CircuitBreakerService circuitBreaker, PerformanceScalerService scaler,
                              TreasuryAnalyticsService analytics, AdminLogService adminLog) {
        this.registry = registry;
        this.ledger = ledger;
        this.circuitBreaker = circuitBreaker;
        this.scaler = scaler;
        this.analytics = analytics;
        this.adminLog = adminLog;
    }

    @PostMapping("/agents")
    public ResponseEntity<AgentBudget> provision(@RequestBody ProvisionRequest request) {
        return ResponseEntity.ok(registry.provision(request.getAgentId(), request.getSeedAmount(),
            request.getDailyLimit(), request.getPerActionLimit(), request.getTimeZone(), request.getActor()));
    }

    @GetMapping("/agents")
    public List<AgentBudget> listBudgets() {
        return registry.listBudgets();
    }

    @GetMapping("/agents/{agentId}")
    public AgentBudget getBudget(@PathVariable("agentId") String agentId) {
        return registry.getBudget(agentId);
    }

    @PostMapping("/agents/{agentId}/authorize")
    public ResponseEntity<Map<String, Object>> authorize(@PathVariable("agentId") String agentId,
                                                         @RequestBody SpendRequest request) {
        TransactionReceipt receipt = registry.authorize(agentId, request.getAmount(),
            request.getDescription(), request.getRoiData());
        return ResponseEntity.ok(receiptBody(receipt));
    }

    @PostMapping("/agents/{agentId}/earnings")
    public ResponseEntity<Map<String, Object>> recordEarning(@PathVariable("agentId") String agentId,
                                                             @RequestBody SpendRequest request) {
        TransactionReceipt receipt = registry.recordEarning(agentId, request.getAmount(),
            request.getDescription(), request.getRoiData());
        return ResponseEntity.ok(receiptBody(receipt));
    }

    @PostMapping("/agents/{agentId}/status")
    public AgentBudget setStatus(@PathVariable("agentId") String agentId, @RequestBody StatusRequest request) {
        return registry.setStatus(agentId, request.getStatus(), request.getActor(), request.getReason());
    }

    @GetMapping("/agents/{agentId}/transactions")
    public List<Transaction> getTransactions(
            @PathVariable("agentId") String agentId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ledger.getTransactions(BudgetRegistryService.normalizeAgentId(agentId), from, to);
    }

    @GetMapping("/agents/{agentId}/transactions/recent")
    public List<Transaction> getRecentTransactions(@PathVariable("agentId") String agentId,
                                                   @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return ledger.getRecentTransactions(BudgetRegistryService.normalizeAgentId(agentId), limit);
    }

    @GetMapping("/agents/{agentId}/performance")
    public PerformanceSnapshot getPerformance(@PathVariable("agentId") String agentId) {
        return scaler.snapshot(agentId);
    }

    @PostMapping("/agents/{agentId}/rescale")
    public RescaleResult rescale(@PathVariable("agentId") String agentId) {
        return scaler.rescale(agentId);
    }

    @PostMapping("/freeze")
    public CircuitBreakerState freeze(@RequestBody BreakerRequest request) {
        return circuitBreaker.freeze(request.getReason(), request.getActor());
    }

    @PostMapping("/unfreeze")
    public CircuitBreakerState unfreeze(@RequestBody BreakerRequest request) {
        return circuitBreaker.unfreeze(request.getReason(), request.getActor());
    }

    @GetMapping("/breaker")
    public CircuitBreakerState breakerState() {
        return circuitBreaker.getState();
    }

    @GetMapping("/admin-events")
    public List<AdminEvent> adminEvents(
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return adminLog.getEvents(from, to);
    }

    @GetMapping("/analytics")
    public TreasuryAnalytics analytics() {
        return analytics.getAnalytics();
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy", "frozen", circuitBreaker.isFrozen()));
    }

    private static Map<String, Object> receiptBody(TransactionReceipt receipt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("transactionId", receipt.getTransactionId());
        body.put("agentId", receipt.getAgentId());
        body.put("balanceAfter", receipt.getBalanceAfter());
        body.put("spentToday", receipt.getSpentToday());
        if (receipt.isAuditDegraded()) {
            body.put("warning", "audit_write_degraded");
        }
        return body;
    }

    @Data
    public static class ProvisionRequest {
        private String agentId;
        private Long seedAmount;
        private Long dailyLimit;
        private Long perActionLimit;
        private String timeZone;
        private String actor = "api";
    }

    @Data
    public static class SpendRequest {
        private long amount;
        private String description;
        private RoiData roiData;
    }

    @Data
    public static class StatusRequest {
        private BudgetStatus status;
        private String actor;
        private String reason;
    }

    @Data
    public static class BreakerRequest {
        private String reason;
        private String actor;
    }
}
