/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.ledger;

import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedgerBackend;
import ch.admin.bj.swiyu.ticketproof.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisNonceLedgerTest {

    private static final long NOW = 1_700_000_000L;
    private static final String PREFIX = "ticketproof:nonce:";

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;
    @Mock
    private Cursor<String> cursor;

    private RedisNonceLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new RedisNonceLedger(redisTemplate, PREFIX, new MutableClock(NOW));
    }

    @Test
    void tryMarkUsed_setsPrefixedKeyIfAbsentWithRemainingTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(PREFIX + "0xabc", String.valueOf(NOW + 300), Duration.ofSeconds(300))).thenReturn(true);

        assertTrue(ledger.tryMarkUsed("0xabc", NOW + 300));
    }

    @Test
    void tryMarkUsed_existingKey_false() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        assertFalse(ledger.tryMarkUsed("0xabc", NOW + 300));
    }

    @Test
    void tryMarkUsed_pastExpiry_usesMinimalTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);

        ledger.tryMarkUsed("0xabc", NOW - 50);

        verify(valueOperations).setIfAbsent(PREFIX + "0xabc", String.valueOf(NOW - 50), Duration.ofSeconds(1));
    }

    @Test
    void tryMarkUsed_nullAnswer_false() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(null);

        assertFalse(ledger.tryMarkUsed("0xabc", NOW + 300));
    }

    @Test
    void tryMarkUsed_connectionFailure_propagates() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertThrows(RedisConnectionFailureException.class, () -> ledger.tryMarkUsed("0xabc", NOW + 300));
    }

    @Test
    void isUsed_checksPrefixedKey() {
        when(redisTemplate.hasKey(PREFIX + "0xabc")).thenReturn(true);
        when(redisTemplate.hasKey(PREFIX + "0xdef")).thenReturn(false);

        assertTrue(ledger.isUsed("0xabc"));
        assertFalse(ledger.isUsed("0xdef"));
    }

    @Test
    void sweepExpired_isLeftToRedis() {
        assertEquals(0, ledger.sweepExpired());
        verifyNoInteractions(redisTemplate);
    }

    @Test
    void stats_scansPrefixedKeysAndClosesCursor() {
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn(PREFIX + "a", PREFIX + "b");

        var stats = ledger.stats();

        assertEquals(2, stats.count());
        assertEquals(NonceLedgerBackend.REDIS, stats.backendKind());
        var options = ArgumentCaptor.forClass(ScanOptions.class);
        verify(redisTemplate).scan(options.capture());
        assertEquals(PREFIX + "*", options.getValue().getPattern());
        verify(cursor).close();
        verify(redisTemplate, never()).keys(anyString());
    }
}
