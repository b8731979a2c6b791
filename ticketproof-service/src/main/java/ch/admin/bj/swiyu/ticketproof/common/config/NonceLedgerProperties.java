/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.common.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * @param durableEnabled try to use redis as durable nonce ledger, falling back to memory if unreachable
 * @param keyPrefix      prefix of every nonce key written to the durable ledger
 * @param sweepInterval  fixed delay between two sweeps of expired nonce records
 */
@Validated
@ConfigurationProperties(prefix = "application.nonce-ledger")
public record NonceLedgerProperties(
        boolean durableEnabled,
        @NotBlank String keyPrefix,
        @NotNull Duration sweepInterval) {
}
