/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.domain.proof;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Single use nonce embedded into a proof. 32 random bytes interpreted as an unsigned 256 bit integer.
 * <p>
 * Uniqueness is not guaranteed by construction, it is enforced when the proof is consumed.
 * </p>
 */
@Getter
@EqualsAndHashCode
public class ProofNonce {

    public static final int NONCE_BYTES = 32;
    private static final int HEX_WIDTH = NONCE_BYTES * 2;

    private final BigInteger value;

    public ProofNonce(BigInteger value) {
        if (value == null || value.signum() < 0 || value.bitLength() > NONCE_BYTES * 8) {
            throw new IllegalArgumentException("Nonce must be an unsigned 256 bit integer");
        }
        this.value = value;
    }

    public static ProofNonce random(SecureRandom secureRandom) {
        var bytes = new byte[NONCE_BYTES];
        secureRandom.nextBytes(bytes);
        return new ProofNonce(new BigInteger(1, bytes));
    }

    /**
     * Fixed width identifier of the nonce, 0x followed by 64 hex digits.
     */
    public String getIdentifier() {
        return Numeric.toHexStringWithPrefixZeroPadded(value, HEX_WIDTH);
    }

    @Override
    public String toString() {
        return getIdentifier();
    }
}
