/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.health;

import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedger;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedgerBackend;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedgerStats;
import ch.admin.bj.swiyu.ticketproof.service.oracle.LedgerOracle;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TicketProofHealthIndicatorTest {

    @Test
    void health_allUp_isUp() {
        var indicator = new TicketProofHealthIndicator(signerKey(Status.UP), ledgerOracle(), nonceLedger(NonceLedgerBackend.REDIS));

        var health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        @SuppressWarnings("unchecked")
        var nonceDetails = (Map<String, Object>) health.getDetails().get("nonceLedger");
        assertEquals("redis", nonceDetails.get("backend"));
        assertEquals(false, nonceDetails.get("degraded"));
    }

    @Test
    void health_signerDown_isDown() {
        var indicator = new TicketProofHealthIndicator(signerKey(Status.DOWN), ledgerOracle(), nonceLedger(NonceLedgerBackend.REDIS));

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    @Test
    void health_failoverLedger_upButDegraded() {
        var indicator = new TicketProofHealthIndicator(signerKey(Status.UP), ledgerOracle(), nonceLedger(NonceLedgerBackend.FAILOVER));

        var health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        @SuppressWarnings("unchecked")
        var nonceDetails = (Map<String, Object>) health.getDetails().get("nonceLedger");
        assertEquals(true, nonceDetails.get("degraded"));
    }

    private static SignerKeyHealthChecker signerKey(Status status) {
        var checker = mock(SignerKeyHealthChecker.class);
        when(checker.getHealthResult()).thenReturn(Health.status(status).build());
        return checker;
    }

    private static LedgerOracleHealthChecker ledgerOracle() {
        var oracle = mock(LedgerOracle.class);
        when(oracle.isContractConfigured()).thenReturn(false);
        var checker = new LedgerOracleHealthChecker(oracle);
        checker.refresh();
        return checker;
    }

    private static NonceLedgerHealthChecker nonceLedger(NonceLedgerBackend backend) {
        var ledger = mock(NonceLedger.class);
        when(ledger.stats()).thenReturn(new NonceLedgerStats(3, backend));
        var checker = new NonceLedgerHealthChecker(ledger);
        checker.refresh();
        return checker;
    }
}
