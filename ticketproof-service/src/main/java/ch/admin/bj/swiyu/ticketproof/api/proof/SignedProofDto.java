/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.proof;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

@Builder
@Schema(name = "SignedProof")
public record SignedProofDto(
        ProofPayloadDto data,
        @Schema(description = "65 byte EIP-712 signature r || s || v as 0x prefixed hex")
        String signature,
        @Schema(description = "UNIX timestamp in seconds after which the proof is no longer accepted")
        long expiresAt,
        @Schema(description = "Whether the ownership was confirmed on chain before signing")
        OwnershipVerificationDto ownershipVerification) {
}
