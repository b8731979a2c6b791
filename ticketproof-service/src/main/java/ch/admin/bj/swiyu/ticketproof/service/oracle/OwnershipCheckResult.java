/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.oracle;

import ch.admin.bj.swiyu.ticketproof.common.exception.ProofError;
import ch.admin.bj.swiyu.ticketproof.domain.proof.OwnershipVerification;

/**
 * Answer of the ledger oracle to an ownership claim.
 *
 * @param valid       the claim may be signed
 * @param reason      why the claim was refused, null if valid
 * @param actualOwner holder reported by the ledger, null if not asked or unknown
 * @param mode        whether the ledger was actually asked
 */
public record OwnershipCheckResult(
        boolean valid,
        ProofError reason,
        String actualOwner,
        OwnershipVerification mode) {

    public static OwnershipCheckResult confirmed(String owner) {
        return new OwnershipCheckResult(true, null, owner, OwnershipVerification.VERIFIED);
    }

    public static OwnershipCheckResult skipped() {
        return new OwnershipCheckResult(true, null, null, OwnershipVerification.UNVERIFIED);
    }

    public static OwnershipCheckResult refused(ProofError reason, String actualOwner) {
        return new OwnershipCheckResult(false, reason, actualOwner, OwnershipVerification.VERIFIED);
    }
}
