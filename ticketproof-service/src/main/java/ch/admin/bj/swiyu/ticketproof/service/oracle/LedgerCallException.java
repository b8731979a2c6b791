/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.oracle;

import lombok.Getter;

/**
 * A call to the ledger node which did not produce a result.
 */
@Getter
public class LedgerCallException extends RuntimeException {

    /**
     * The contract reverted because the entitlement does not exist.
     */
    private final boolean entitlementMissing;

    public LedgerCallException(String message, boolean entitlementMissing) {
        super(message);
        this.entitlementMissing = entitlementMissing;
    }

    public LedgerCallException(String message, Throwable cause) {
        super(message, cause);
        this.entitlementMissing = false;
    }
}
