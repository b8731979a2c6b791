/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.common.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * EIP-712 domain of the deployment. The verifying contract is taken from {@link LedgerProperties}.
 */
@Validated
@ConfigurationProperties(prefix = "application.domain")
public record DomainProperties(
        @NotBlank String protocolName,
        @NotBlank String version,
        @NotNull @Positive Long chainId) {
}
