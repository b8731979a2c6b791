/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.oracle;

import java.math.BigInteger;

/**
 * Read access to the entitlement contract on the ledger.
 */
public interface EntitlementContract {

    /**
     * @return current holder of the entitlement, 0x prefixed address
     * @throws LedgerCallException if the node could not answer or the contract reverted
     */
    String ownerOf(BigInteger entitlementId);

    /**
     * @return true if the entitlement was marked as used on chain
     * @throws LedgerCallException if the node could not answer or the contract reverted
     */
    boolean isUsed(BigInteger entitlementId);

    /**
     * @return number of the latest block known to the node
     * @throws LedgerCallException if the node could not answer
     */
    BigInteger latestBlockNumber();
}
