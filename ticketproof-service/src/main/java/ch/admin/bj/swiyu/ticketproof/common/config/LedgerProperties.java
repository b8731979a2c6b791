/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.common.config;

import jakarta.validation.constraints.NotNull;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URL;
import java.time.Duration;

/**
 * Connection to the ledger node holding the entitlement contract.
 *
 * @param rpcUrl            JSON-RPC endpoint of the node
 * @param verifyingContract address of the entitlement contract; blank runs the service in unverified mode
 * @param timeout           upper bound for a single ledger call
 */
@Validated
@ConfigurationProperties(prefix = "application.ledger")
public record LedgerProperties(
        @NotNull URL rpcUrl,
        String verifyingContract,
        @NotNull Duration timeout) {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    public boolean isContractConfigured() {
        return StringUtils.isNotBlank(verifyingContract) && !ZERO_ADDRESS.equalsIgnoreCase(verifyingContract);
    }

    public String verifyingContractOrZeroAddress() {
        return isContractConfigured() ? verifyingContract : ZERO_ADDRESS;
    }
}
