/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.domain.ledger;

/**
 * Store of consumed nonces with expiry.
 * <p>
 * Implementations must be safe for concurrent use. {@link #tryMarkUsed(String, long)} is the only
 * authoritative decision point and has to be linearizable per key.
 * </p>
 */
public interface NonceLedger extends AutoCloseable {

    /**
     * Atomically records the key unless an unexpired record for it exists.
     * An existing unexpired record is never overwritten.
     *
     * @param key       nonce key
     * @param expiresAt UNIX timestamp in seconds after which the record may be removed
     * @return true if the key was recorded by this call, false if it was already present
     */
    boolean tryMarkUsed(String key, long expiresAt);

    /**
     * Read only lookup. Not to be used for replay decisions, use {@link #tryMarkUsed(String, long)}.
     */
    boolean isUsed(String key);

    /**
     * Removes all records whose expiry has passed.
     *
     * @return number of removed records
     */
    int sweepExpired();

    NonceLedgerStats stats();

    /**
     * Releases backend resources. The ledger must not be used afterwards.
     */
    @Override
    void close();
}
