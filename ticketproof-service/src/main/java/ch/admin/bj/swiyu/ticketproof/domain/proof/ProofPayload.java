/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.domain.proof;

import lombok.Builder;

import java.math.BigInteger;

/**
 * The signed content of a ticket proof.
 *
 * @param entitlementId token id of the ticket, uint256
 * @param owner         20 byte address of the holder, 0x prefixed hex
 * @param issuedAt      UNIX timestamp in seconds
 * @param nonce         single use random value, uint256
 */
@Builder(toBuilder = true)
public record ProofPayload(
        BigInteger entitlementId,
        String owner,
        long issuedAt,
        BigInteger nonce) {
}
