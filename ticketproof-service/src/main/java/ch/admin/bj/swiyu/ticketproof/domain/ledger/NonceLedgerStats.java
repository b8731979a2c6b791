/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.domain.ledger;

/**
 * @param count       number of nonce records currently held, -1 if the backend could not be asked
 * @param backendKind backend serving the ledger
 */
public record NonceLedgerStats(long count, NonceLedgerBackend backendKind) {
}
