/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.domain.proof;

import lombok.Builder;

/**
 * A proof as handed out to the holder. Only created by the proof service.
 */
@Builder
public record SignedProof(
        ProofPayload payload,
        String signature,
        long expiresAt,
        OwnershipVerification ownershipVerification) {
}
