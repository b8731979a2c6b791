/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.domain.proof;

/**
 * @param requireOnChainConfirmation ask the ledger oracle before signing
 */
public record IssuancePolicy(boolean requireOnChainConfirmation) {

    public static IssuancePolicy onChainConfirmed() {
        return new IssuancePolicy(true);
    }

    public static IssuancePolicy unconfirmed() {
        return new IssuancePolicy(false);
    }
}
