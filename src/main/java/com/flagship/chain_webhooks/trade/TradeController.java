package com.flagship.chain_webhooks.trade;

import com.flagship.chain_webhooks.trade.dto.TradeResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of trade confirmation state, used by the escrow panel.
 */
@RestController
@RequestMapping("/api/trades")
@RequiredArgsConstructor
public class TradeController {

    private final TradeConfirmationService confirmationService;

    @GetMapping("/{tradeId}")
    public TradeResponse getTrade(@PathVariable("tradeId") String tradeId) {
        return TradeResponse.from(confirmationService.getTrade(tradeId));
    }
}
