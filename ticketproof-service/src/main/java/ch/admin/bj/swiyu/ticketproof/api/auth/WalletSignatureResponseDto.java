/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.auth;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "WalletSignatureResponse")
public record WalletSignatureResponseDto(boolean valid) {
}
