/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.ledger;

import ch.admin.bj.swiyu.ticketproof.common.date.TimeUtils;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedger;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedgerBackend;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedgerStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Durable nonce ledger backed by redis. Expiry is delegated to the redis TTL of each key.
 * <p>
 * Connection problems surface as {@link org.springframework.dao.DataAccessException}.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class RedisNonceLedger implements NonceLedger {

    private static final long SCAN_BATCH_SIZE = 1000;

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Clock clock;

    /**
     * Round trip to redis, throws if the server can not be reached.
     */
    public String ping() {
        return redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
    }

    @Override
    public boolean tryMarkUsed(String key, long expiresAt) {
        var ttl = Duration.ofSeconds(Math.max(expiresAt - TimeUtils.nowEpochSeconds(clock), 1));
        // SET NX EX, redis decides atomically which writer wins
        Boolean wasSet = redisTemplate.opsForValue().setIfAbsent(buildKey(key), String.valueOf(expiresAt), ttl);
        return Boolean.TRUE.equals(wasSet);
    }

    @Override
    public boolean isUsed(String key) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(buildKey(key)));
    }

    @Override
    public int sweepExpired() {
        log.trace("Redis expires nonce keys by TTL, nothing to sweep");
        return 0;
    }

    @Override
    public NonceLedgerStats stats() {
        var options = ScanOptions.scanOptions().match(keyPrefix + "*").count(SCAN_BATCH_SIZE).build();
        long count = 0;
        // SCAN walks the keyspace incrementally instead of blocking redis like KEYS
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                cursor.next();
                count++;
            }
        }
        return new NonceLedgerStats(count, NonceLedgerBackend.REDIS);
    }

    @Override
    public void close() {
        // connection factory is owned by the spring context
        log.info("Closing redis nonce ledger");
    }

    private String buildKey(String key) {
        return keyPrefix + key;
    }
}
