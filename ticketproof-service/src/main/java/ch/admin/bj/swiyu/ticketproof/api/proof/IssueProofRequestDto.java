/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.proof;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

@Schema(name = "IssueProofRequest")
public record IssueProofRequestDto(
        @NotNull
        @PositiveOrZero
        @JsonAlias("tokenId")
        @Schema(description = "Token id of the ticket to prove", example = "42", type = "string")
        BigInteger entitlementId) {
}
