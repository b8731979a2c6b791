/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Health check whose result is computed on a fixed delay and served from cache,
 * so health requests never wait for remote systems.
 */
@Slf4j
public abstract class CachedHealthChecker {

    private volatile Health healthResult = Health.unknown().build();

    public Health getHealthResult() {
        return healthResult;
    }

    @Scheduled(initialDelay = 0, fixedDelayString = "${application.health.refresh-interval:PT30S}")
    public void refresh() {
        var builder = Health.unknown();
        try {
            performCheck(builder);
        } catch (Exception e) {
            log.debug("Health check {} failed", getClass().getSimpleName(), e);
            builder.down(e);
        }
        healthResult = builder.build();
    }

    protected abstract void performCheck(Health.Builder builder) throws Exception;
}
