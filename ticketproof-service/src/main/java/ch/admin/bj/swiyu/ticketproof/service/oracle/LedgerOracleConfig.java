/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.oracle;

import ch.admin.bj.swiyu.ticketproof.common.config.LedgerProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Slf4j
@Configuration
public class LedgerOracleConfig {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(LedgerProperties ledgerProperties) {
        return Web3j.build(new HttpService(ledgerProperties.rpcUrl().toString()));
    }

    @Bean
    public LedgerOracle ledgerOracle(LedgerProperties ledgerProperties, Web3j web3j, MeterRegistry meterRegistry) {
        if (!ledgerProperties.isContractConfigured()) {
            log.warn("application.ledger.verifying-contract is not set, ownership claims are accepted without ledger check");
            return new LedgerOracle(null, meterRegistry);
        }
        log.info("Ownership claims are checked against {} on {}", ledgerProperties.verifyingContract(), ledgerProperties.rpcUrl());
        var contract = new Web3EntitlementContract(web3j, ledgerProperties.verifyingContract(), ledgerProperties.timeout());
        return new LedgerOracle(contract, meterRegistry);
    }
}
