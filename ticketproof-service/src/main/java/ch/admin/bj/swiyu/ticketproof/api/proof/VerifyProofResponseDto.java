/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.proof;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.math.BigInteger;

@Builder
@Schema(name = "VerifyProofResponse")
public record VerifyProofResponseDto(
        boolean valid,
        @Schema(description = "Address which signed the proof")
        String signer,
        String owner,
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        BigInteger tokenId,
        long timestamp) {
}
