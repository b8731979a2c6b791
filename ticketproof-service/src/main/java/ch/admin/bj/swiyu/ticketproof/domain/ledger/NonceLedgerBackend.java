/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.domain.ledger;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum NonceLedgerBackend {
    REDIS("redis"),
    IN_MEMORY("in-memory"),
    /**
     * Durable backend configured but at least one call had to be served from memory.
     */
    FAILOVER("failover");

    private final String name;

    @Override
    public String toString() {
        return getName();
    }
}
