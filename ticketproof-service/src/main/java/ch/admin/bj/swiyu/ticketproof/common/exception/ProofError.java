/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Reasons a ticket proof can not be issued or verified.
 * Every reason maps to its own caller facing outcome, they must never be merged.
 */
@Getter
@RequiredArgsConstructor
public enum ProofError {
    MALFORMED_INPUT("malformed_input", false),
    INVALID_SIGNATURE("invalid_signature", false),
    EXPIRED("expired", false),
    NOT_YET_VALID("not_yet_valid", false),
    REPLAYED_PROOF("replayed_proof", false),
    NOT_OWNER("not_owner", false),
    ALREADY_CONSUMED("already_consumed", false),
    ENTITLEMENT_NOT_FOUND("entitlement_not_found", false),
    ORACLE_UNAVAILABLE("oracle_unavailable", true),
    STORAGE_UNAVAILABLE("storage_unavailable", true);

    private final String code;
    private final boolean retryable;

    @Override
    public String toString() {
        return getCode();
    }
}
