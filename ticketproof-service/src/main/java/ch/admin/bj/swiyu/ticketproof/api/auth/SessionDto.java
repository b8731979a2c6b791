/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.auth;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "Session")
public record SessionDto(
        @Schema(description = "Bearer token for the proof endpoints")
        String token,
        String address,
        long expiresAt) {
}
