/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.proof;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

@Builder
@Schema(name = "SignerInfo", description = "Signer address and EIP-712 domain used for ticket proofs")
public record SignerInfoDto(
        String address,
        String name,
        String version,
        long chainId,
        String verifyingContract,
        OwnershipVerificationDto ownershipVerification) {
}
