/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.proof;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "OwnershipVerification", enumAsRef = true)
public enum OwnershipVerificationDto {
    VERIFIED,
    UNVERIFIED
}
