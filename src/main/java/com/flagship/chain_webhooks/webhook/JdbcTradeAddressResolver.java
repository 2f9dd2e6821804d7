package com.flagship.chain_webhooks.webhook;

import com.flagship.chain_webhooks.event.Network;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Looks up trade deposit addresses in the wallet subsystem's trade_wallets
 * table. Ethereum addresses are hex and compared case-insensitively; other
 * networks use case-sensitive encodings and are matched exactly.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcTradeAddressResolver implements TradeAddressResolver {

    private static final String EXACT_MATCH_SQL =
        "SELECT trade_id FROM trade_wallets WHERE network = ? AND address = ? LIMIT 1";
    private static final String CASE_INSENSITIVE_MATCH_SQL =
        "SELECT trade_id FROM trade_wallets WHERE network = ? AND lower(address) = lower(?) LIMIT 1";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<String> resolveTradeId(String address, Network network) {
        String sql = network == Network.ETH ? CASE_INSENSITIVE_MATCH_SQL : EXACT_MATCH_SQL;
        List<String> tradeIds = jdbcTemplate.queryForList(sql, String.class, network.name(), address);
        if (tradeIds.isEmpty()) {
            return Optional.empty();
        }
        log.debug("Address on {} belongs to trade {}", network, tradeIds.get(0));
        return Optional.of(tradeIds.get(0));
    }
}
