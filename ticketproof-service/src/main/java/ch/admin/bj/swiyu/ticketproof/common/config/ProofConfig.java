/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.common.config;

import ch.admin.bj.swiyu.ticketproof.common.exception.ConfigurationException;
import ch.admin.bj.swiyu.ticketproof.domain.proof.DomainParameters;
import ch.admin.bj.swiyu.ticketproof.service.ProofCodec;
import ch.admin.bj.swiyu.ticketproof.service.SignerIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;

@Slf4j
@Configuration
public class ProofConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public DomainParameters domainParameters(DomainProperties domainProperties, LedgerProperties ledgerProperties) {
        if (!ledgerProperties.isContractConfigured()) {
            log.warn("No verifying contract configured, proofs are bound to the zero address");
        }
        return DomainParameters.builder()
                .protocolName(domainProperties.protocolName())
                .version(domainProperties.version())
                .chainId(BigInteger.valueOf(domainProperties.chainId()))
                .verifyingContract(ledgerProperties.verifyingContractOrZeroAddress())
                .build();
    }

    @Bean
    public SignerIdentity signerIdentity(ApplicationProperties applicationProperties, ProofCodec proofCodec) {
        SignerIdentity signerIdentity;
        try {
            signerIdentity = new SignerIdentity(applicationProperties.getSignerPrivateKey(), proofCodec);
        } catch (RuntimeException e) {
            // the exception message of web3j may contain parts of the key, so it is not passed on
            throw new ConfigurationException("application.signer-private-key is not a valid secp256k1 private key");
        }
        log.info("Ticket proofs are signed by {}", signerIdentity.getAddress());
        return signerIdentity;
    }
}
