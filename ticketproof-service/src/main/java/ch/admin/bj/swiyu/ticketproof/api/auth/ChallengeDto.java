/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

@Builder
@Schema(name = "Challenge", description = "Message the wallet has to sign with personal_sign to log in")
public record ChallengeDto(
        String address,
        String message,
        String nonce,
        long issuedAt,
        long expiresAt) {
}
