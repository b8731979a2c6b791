/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.domain.proof;

import lombok.Builder;

import java.math.BigInteger;

@Builder
public record VerifyResult(
        boolean valid,
        String signer,
        String owner,
        BigInteger entitlementId,
        long issuedAt) {
}
