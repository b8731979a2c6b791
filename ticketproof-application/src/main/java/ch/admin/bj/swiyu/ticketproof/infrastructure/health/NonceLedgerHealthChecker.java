/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.health;

import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedger;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedgerBackend;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;

/**
 * Reports the backend serving the nonce ledger. A degraded ledger still accepts proofs, so it stays up.
 */
@Component
@RequiredArgsConstructor
public class NonceLedgerHealthChecker extends CachedHealthChecker {

    private final NonceLedger nonceLedger;

    @Override
    protected void performCheck(Health.Builder builder) {
        var stats = nonceLedger.stats();
        builder.up()
                .withDetail("backend", stats.backendKind().getName())
                .withDetail("records", stats.count())
                .withDetail("degraded", stats.backendKind() == NonceLedgerBackend.FAILOVER);
    }
}
