/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.domain.proof;

/**
 * Whether the ledger confirmed the ownership before a proof was signed.
 */
public enum OwnershipVerification {
    /**
     * The ledger reported the claimed owner as current holder of an unused entitlement.
     */
    VERIFIED,
    /**
     * No ledger check took place, either by policy or because no contract is configured.
     */
    UNVERIFIED
}
