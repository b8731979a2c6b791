/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.ledger;

import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedger;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedgerBackend;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedgerStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serves the durable ledger and keeps going on the in-process fallback while the durable backend is
 * unavailable.
 * <p>
 * Every nonce is first claimed atomically in the fallback, so two calls for the same nonce on this
 * instance are decided there no matter how the durable backend behaves in between. The durable
 * backend then decides between instances. A nonce claimed while the durable backend failed counts
 * as consumed until it expires.
 * </p>
 */
@Slf4j
public class FailoverNonceLedger implements NonceLedger {

    private final NonceLedger durable;
    private final NonceLedger fallback;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public FailoverNonceLedger(NonceLedger durable, NonceLedger fallback) {
        this.durable = durable;
        this.fallback = fallback;
    }

    @Override
    public boolean tryMarkUsed(String key, long expiresAt) {
        if (!fallback.tryMarkUsed(key, expiresAt)) {
            return false;
        }
        try {
            var recorded = durable.tryMarkUsed(key, expiresAt);
            if (!recorded) {
                log.debug("Nonce {} was already consumed through another instance", key);
            }
            return recorded;
        } catch (DataAccessException e) {
            markDegraded("tryMarkUsed", e);
            return true;
        }
    }

    @Override
    public boolean isUsed(String key) {
        if (fallback.isUsed(key)) {
            return true;
        }
        try {
            return durable.isUsed(key);
        } catch (DataAccessException e) {
            markDegraded("isUsed", e);
            return false;
        }
    }

    @Override
    public int sweepExpired() {
        var removed = 0;
        try {
            removed += durable.sweepExpired();
        } catch (DataAccessException e) {
            markDegraded("sweepExpired", e);
        }
        return removed + fallback.sweepExpired();
    }

    @Override
    public NonceLedgerStats stats() {
        try {
            var durableStats = durable.stats();
            if (!degraded.get()) {
                return durableStats;
            }
            // most nonces are held by both backends
            return new NonceLedgerStats(Math.max(durableStats.count(), fallback.stats().count()),
                    NonceLedgerBackend.FAILOVER);
        } catch (DataAccessException e) {
            markDegraded("stats", e);
            return new NonceLedgerStats(fallback.stats().count(), NonceLedgerBackend.FAILOVER);
        }
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    @Override
    public void close() {
        try {
            durable.close();
        } finally {
            fallback.close();
        }
    }

    private void markDegraded(String operation, DataAccessException e) {
        if (!degraded.getAndSet(true)) {
            log.warn("Durable nonce ledger unavailable during {}, continuing with in-memory fallback", operation, e);
        } else {
            log.warn("Durable nonce ledger unavailable during {}: {}", operation, e.getMessage());
        }
    }
}
