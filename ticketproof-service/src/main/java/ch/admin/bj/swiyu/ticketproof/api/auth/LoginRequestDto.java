/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "LoginRequest")
public record LoginRequestDto(
        @NotBlank
        String address,
        @NotBlank
        @Schema(description = "The challenge message exactly as handed out")
        String message,
        @NotBlank
        @Schema(description = "EIP-191 signature of the message as 0x prefixed hex")
        String signature) {
}
