package com.flagship.chain_webhooks.admin;

import com.flagship.chain_webhooks.trade.ConfirmationPolicy;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints: confirmation threshold, pipeline stats and recently
 * active trades.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final ConfirmationPolicy confirmationPolicy;
    private final ProcessingStatsService statsService;

    @GetMapping("/confirmation-threshold")
    public Map<String, Integer> getThreshold() {
        return Map.of("threshold", confirmationPolicy.getThreshold());
    }

    @PutMapping("/confirmation-threshold")
    public Map<String, Integer> setThreshold(@Valid @RequestBody ThresholdRequest request) {
        int previous = confirmationPolicy.setThreshold(request.getThreshold());
        Map<String, Integer> response = new LinkedHashMap<>();
        response.put("previous", previous);
        response.put("threshold", confirmationPolicy.getThreshold());
        return response;
    }

    @GetMapping("/stats")
    public ProcessingStats stats() {
        return statsService.snapshot();
    }

    @GetMapping("/transactions")
    public List<RecentTransaction> recentTransactions(
            @RequestParam(value = "limit", defaultValue = "" + ProcessingStatsService.DEFAULT_RECENT_LIMIT) int limit) {
        return statsService.recentTransactions(limit);
    }
}
