/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.health;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregates the cached results of the individual health checkers into a single indicator.
 * <p>Propagates DOWN if any underlying checker is not UP and exposes the details of each checker.</p>
 */
@Component
@RequiredArgsConstructor
public class TicketProofHealthIndicator implements HealthIndicator {

    private final SignerKeyHealthChecker signerKey;
    private final LedgerOracleHealthChecker ledgerOracle;
    private final NonceLedgerHealthChecker nonceLedger;

    @Override
    public Health health() {
        Health.Builder builder = Health.up();

        Map<String, Health> checks = new LinkedHashMap<>();
        checks.put("signerKey", signerKey.getHealthResult());
        checks.put("ledgerOracle", ledgerOracle.getHealthResult());
        checks.put("nonceLedger", nonceLedger.getHealthResult());

        checks.forEach((name, health) -> {
            builder.withDetail(name, health.getDetails());
            if (!Status.UP.equals(health.getStatus())) {
                builder.status(health.getStatus());
            }
        });

        return builder.build();
    }
}
