/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Schema(name = "WalletSignatureRequest")
public record WalletSignatureRequestDto(
        @NotBlank
        String address,
        @NotNull
        String message,
        @NotBlank
        String signature) {
}
