/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.health;

import ch.admin.bj.swiyu.ticketproof.domain.proof.DomainParameters;
import ch.admin.bj.swiyu.ticketproof.domain.proof.ProofPayload;
import ch.admin.bj.swiyu.ticketproof.service.SignerIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Signs a throw-away proof and checks that it recovers to the signer address.
 */
@Component
@RequiredArgsConstructor
public class SignerKeyHealthChecker extends CachedHealthChecker {

    private static final String HEALTH_DETAIL_SIGNER = "signerAddress";
    private static final String HEALTH_DETAIL_ERROR = "error";

    private final SignerIdentity signerIdentity;
    private final DomainParameters domainParameters;

    @Override
    protected void performCheck(Health.Builder builder) {
        builder.withDetail(HEALTH_DETAIL_SIGNER, signerIdentity.getAddress());
        var payload = ProofPayload.builder()
                .entitlementId(BigInteger.ZERO)
                .owner(signerIdentity.getAddress())
                .issuedAt(0)
                .nonce(BigInteger.ZERO)
                .build();
        try {
            var signature = signerIdentity.sign(domainParameters, payload);
            var recovered = signerIdentity.recoverSigner(domainParameters, payload, signature);
            if (recovered.equalsIgnoreCase(signerIdentity.getAddress())) {
                builder.up();
            } else {
                builder.down().withDetail(HEALTH_DETAIL_ERROR, "Test signature recovered to " + recovered);
            }
        } catch (Exception e) {
            builder.down().withDetail(HEALTH_DETAIL_ERROR, e.getMessage());
        }
    }
}
