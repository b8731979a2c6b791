/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.session;

/**
 * @param token     compact serialized JWT
 * @param address   wallet address the session belongs to, lower case
 * @param expiresAt UNIX timestamp in seconds
 */
public record SessionToken(String token, String address, long expiresAt) {
}
