/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.health;

import ch.admin.bj.swiyu.ticketproof.service.oracle.LedgerCallException;
import ch.admin.bj.swiyu.ticketproof.service.oracle.LedgerOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerOracleHealthChecker extends CachedHealthChecker {

    private final LedgerOracle ledgerOracle;

    @Override
    protected void performCheck(Health.Builder builder) {
        if (!ledgerOracle.isContractConfigured()) {
            builder.up().withDetail("mode", "unverified");
            return;
        }
        builder.withDetail("mode", "verified");
        try {
            builder.up().withDetail("latestBlock", ledgerOracle.latestBlockNumber());
        } catch (LedgerCallException e) {
            log.debug("Ledger node not reachable: {}", e.getMessage());
            builder.down().withDetail("error", e.getMessage());
        }
    }
}
