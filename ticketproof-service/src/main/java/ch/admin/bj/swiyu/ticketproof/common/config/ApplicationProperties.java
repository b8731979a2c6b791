/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.common.config;

import ch.admin.bj.swiyu.ticketproof.common.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Slf4j
@Configuration
@Validated
@Data
@ConfigurationProperties(prefix = "application")
public class ApplicationProperties {

    /**
     * Seconds a ticket proof stays acceptable after it was issued.
     */
    @Min(1)
    private long proofValiditySeconds = 60;

    /**
     * Seconds a consumed nonce is remembered, counted from the proof's issuance.
     * Must exceed the proof validity so a proof can never outlive its nonce record.
     */
    @Min(1)
    private long nonceRetentionSeconds = 300;

    /**
     * Tolerated clock skew for proofs issued "in the future" by a node with a faster clock.
     */
    @Min(0)
    private long clockSkewToleranceSeconds = 5;

    /**
     * If set, proofs are only issued after the ledger confirmed the claimed owner.
     */
    private boolean requireOnChainConfirmation = true;

    /**
     * Hex encoded secp256k1 private key of the service signer.
     * Only to be provided through secure configuration.
     */
    @NotBlank
    private String signerPrivateKey;

    @PostConstruct
    public void init() {
        if (nonceRetentionSeconds <= proofValiditySeconds) {
            log.error("Nonce retention of {}s does not exceed proof validity of {}s", nonceRetentionSeconds, proofValiditySeconds);
            throw new ConfigurationException(
                    "application.nonce-retention-seconds must be greater than application.proof-validity-seconds");
        }
    }
}
