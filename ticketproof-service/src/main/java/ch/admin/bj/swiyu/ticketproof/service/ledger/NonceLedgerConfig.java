/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.ledger;

import ch.admin.bj.swiyu.ticketproof.common.config.NonceLedgerProperties;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Selects the nonce ledger backend at startup.
 * <p>
 * A durable ledger which can not be reached never stops the application, the in-memory ledger is
 * used instead. The validity window of the proofs bounds what can be lost with it.
 * </p>
 */
@Slf4j
@Configuration
public class NonceLedgerConfig {

    @Bean(destroyMethod = "close")
    public NonceLedger nonceLedger(NonceLedgerProperties properties,
                                   ObjectProvider<StringRedisTemplate> redisTemplateProvider,
                                   Clock clock) {
        var inMemory = new InMemoryNonceLedger(clock);
        if (!properties.durableEnabled()) {
            log.info("Durable nonce ledger disabled, using in-memory nonce ledger");
            return inMemory;
        }

        var redisTemplate = redisTemplateProvider.getIfAvailable();
        if (redisTemplate == null) {
            log.warn("Durable nonce ledger enabled but no redis connection configured, using in-memory nonce ledger");
            return inMemory;
        }

        var redis = new RedisNonceLedger(redisTemplate, properties.keyPrefix(), clock);
        try {
            redis.ping();
        } catch (Exception e) {
            log.warn("Durable nonce ledger not reachable, falling back to in-memory nonce ledger: {}", e.getMessage());
            return inMemory;
        }
        log.info("Using redis nonce ledger with key prefix '{}'", properties.keyPrefix());
        return new FailoverNonceLedger(redis, inMemory);
    }
}
