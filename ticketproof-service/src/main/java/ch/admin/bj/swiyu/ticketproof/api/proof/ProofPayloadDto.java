/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.proof;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

import java.math.BigInteger;

@Builder
@Schema(name = "ProofPayload", description = "Signed content of a ticket proof, the TicketProof EIP-712 struct")
public record ProofPayloadDto(
        @NotNull
        @JsonAlias("entitlementId")
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        @Schema(description = "Token id of the ticket as decimal uint256", example = "42", type = "string")
        BigInteger tokenId,
        @NotBlank
        @Schema(description = "Address of the ticket holder", example = "0x70997970C51812dc3A010C7d01b50e0d17dc79C8")
        String owner,
        @NotNull
        @PositiveOrZero
        @Schema(description = "UNIX timestamp in seconds at which the proof was issued")
        Long timestamp,
        @NotNull
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        @Schema(description = "Single use nonce as decimal uint256", type = "string")
        BigInteger nonce) {
}
