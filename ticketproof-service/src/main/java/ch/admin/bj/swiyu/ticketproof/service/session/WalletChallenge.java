/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.session;

/**
 * Sign-in message handed to a wallet. Can be used for exactly one login.
 */
public record WalletChallenge(String address, String message, String nonce, long issuedAt, long expiresAt) {

    public boolean isExpired(long now) {
        return now > expiresAt;
    }
}
