/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.domain.proof;

import lombok.Builder;

import java.math.BigInteger;

/**
 * EIP-712 domain separator values. Issuance and verification must use the identical tuple,
 * otherwise the recovered signer differs.
 */
@Builder
public record DomainParameters(
        String protocolName,
        String version,
        BigInteger chainId,
        String verifyingContract) {
}
