/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.ledger;

import ch.admin.bj.swiyu.ticketproof.common.date.TimeUtils;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedger;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedgerBackend;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedgerStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process local nonce ledger. Lost on restart, which is acceptable as proofs are only valid for a short window.
 */
@Slf4j
@RequiredArgsConstructor
public class InMemoryNonceLedger implements NonceLedger {

    private final Map<String, Long> records = new ConcurrentHashMap<>();
    private final Clock clock;

    @Override
    public boolean tryMarkUsed(String key, long expiresAt) {
        var now = TimeUtils.nowEpochSeconds(clock);
        var recorded = new AtomicBoolean(false);
        // compute holds the bin lock of the key, so check and write happen as one step
        records.compute(key, (k, existingExpiry) -> {
            if (existingExpiry != null && !isExpired(existingExpiry, now)) {
                return existingExpiry;
            }
            recorded.set(true);
            return expiresAt;
        });
        return recorded.get();
    }

    @Override
    public boolean isUsed(String key) {
        var expiresAt = records.get(key);
        return expiresAt != null && !isExpired(expiresAt, TimeUtils.nowEpochSeconds(clock));
    }

    @Override
    public int sweepExpired() {
        var cutoff = TimeUtils.nowEpochSeconds(clock);
        var removed = 0;
        for (var entry : records.entrySet()) {
            // conditional remove: a record rewritten after the cutoff was read keeps its new expiry
            if (isExpired(entry.getValue(), cutoff) && records.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired nonces from memory, {} remaining", removed, records.size());
        }
        return removed;
    }

    @Override
    public NonceLedgerStats stats() {
        return new NonceLedgerStats(records.size(), NonceLedgerBackend.IN_MEMORY);
    }

    @Override
    public void close() {
        records.clear();
    }

    private static boolean isExpired(long expiresAt, long now) {
        return expiresAt < now;
    }
}
