/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service;

import ch.admin.bj.swiyu.ticketproof.common.config.ApplicationProperties;
import ch.admin.bj.swiyu.ticketproof.common.date.TimeUtils;
import ch.admin.bj.swiyu.ticketproof.common.exception.MalformedSignatureException;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofError;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofException;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedger;
import ch.admin.bj.swiyu.ticketproof.domain.proof.DomainParameters;
import ch.admin.bj.swiyu.ticketproof.domain.proof.IssuancePolicy;
import ch.admin.bj.swiyu.ticketproof.domain.proof.OwnershipVerification;
import ch.admin.bj.swiyu.ticketproof.domain.proof.ProofNonce;
import ch.admin.bj.swiyu.ticketproof.domain.proof.ProofPayload;
import ch.admin.bj.swiyu.ticketproof.domain.proof.SignedProof;
import ch.admin.bj.swiyu.ticketproof.domain.proof.VerifyResult;
import ch.admin.bj.swiyu.ticketproof.service.oracle.LedgerOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Map;

/**
 * Issues ticket proofs and accepts each of them exactly once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProofService {

    private final ApplicationProperties applicationProperties;
    private final DomainParameters domainParameters;
    private final ProofCodec proofCodec;
    private final SignerIdentity signerIdentity;
    private final LedgerOracle ledgerOracle;
    private final NonceLedger nonceLedger;
    private final Clock clock;
    private final SecureRandom secureRandom;

    /**
     * Issues a proof with the configured issuance policy.
     */
    public SignedProof issue(BigInteger entitlementId, String claimedOwner) {
        return issue(entitlementId, claimedOwner, new IssuancePolicy(applicationProperties.isRequireOnChainConfirmation()));
    }

    /**
     * Signs a proof that the claimed owner holds the entitlement right now.
     * Nothing is written to the nonce ledger, the nonce is only recorded when the proof is consumed.
     *
     * @throws ProofException with the reason of the ledger oracle if the claim was refused
     */
    public SignedProof issue(BigInteger entitlementId, String claimedOwner, IssuancePolicy policy) {
        if (!ProofCodec.isUint256(entitlementId)) {
            throw ProofException.malformedInput("Entitlement id must be an unsigned 256 bit integer");
        }
        if (!ProofCodec.isAddress(claimedOwner)) {
            throw ProofException.malformedInput("Owner must be a 0x prefixed 20 byte address");
        }

        var ownershipVerification = OwnershipVerification.UNVERIFIED;
        if (policy.requireOnChainConfirmation()) {
            var check = ledgerOracle.checkOwnership(entitlementId, claimedOwner);
            if (!check.valid()) {
                throw new ProofException(check.reason(), refusalMessage(check.reason(), entitlementId),
                        check.actualOwner() == null ? Map.of() : Map.of("actualOwner", check.actualOwner()));
            }
            ownershipVerification = check.mode();
        }

        var issuedAt = TimeUtils.nowEpochSeconds(clock);
        var payload = ProofPayload.builder()
                .entitlementId(entitlementId)
                .owner(claimedOwner)
                .issuedAt(issuedAt)
                .nonce(ProofNonce.random(secureRandom).getValue())
                .build();
        var signature = signerIdentity.sign(domainParameters, payload);

        log.debug("Issued {} proof for entitlement {} to {}", ownershipVerification, entitlementId, claimedOwner);
        return SignedProof.builder()
                .payload(payload)
                .signature(signature)
                .expiresAt(issuedAt + applicationProperties.getProofValiditySeconds())
                .ownershipVerification(ownershipVerification)
                .build();
    }

    /**
     * Verifies a presented proof and consumes its nonce.
     *
     * @throws ProofException if the proof is not accepted
     */
    public VerifyResult verify(ProofPayload payload, String signature) {
        proofCodec.validate(payload);

        String signer;
        try {
            signer = signerIdentity.recoverSigner(domainParameters, payload, signature);
        } catch (MalformedSignatureException e) {
            log.debug("Rejected proof for entitlement {}: {}", payload.entitlementId(), e.getMessage());
            throw ProofException.invalidSignature();
        }
        if (!signer.equalsIgnoreCase(signerIdentity.getAddress())) {
            log.debug("Rejected proof for entitlement {} signed by {}", payload.entitlementId(), signer);
            throw ProofException.invalidSignature();
        }

        var age = TimeUtils.nowEpochSeconds(clock) - payload.issuedAt();
        if (age > applicationProperties.getProofValiditySeconds()) {
            log.debug("Rejected proof for entitlement {} issued {}s ago", payload.entitlementId(), age);
            throw new ProofException(ProofError.EXPIRED, "Proof expired at "
                    + TimeUtils.epochSecondsToISO8601(payload.issuedAt() + applicationProperties.getProofValiditySeconds()));
        }
        if (age < -applicationProperties.getClockSkewToleranceSeconds()) {
            log.debug("Rejected proof for entitlement {} issued {}s in the future", payload.entitlementId(), -age);
            throw new ProofException(ProofError.NOT_YET_VALID, "Proof is issued in the future");
        }

        var nonceKey = new ProofNonce(payload.nonce()).getIdentifier();
        if (!markUsed(nonceKey, payload.issuedAt() + applicationProperties.getNonceRetentionSeconds())) {
            log.debug("Rejected replay of nonce {} for entitlement {}", nonceKey, payload.entitlementId());
            throw new ProofException(ProofError.REPLAYED_PROOF, "Proof was already used");
        }

        return VerifyResult.builder()
                .valid(true)
                .signer(signer)
                .owner(payload.owner())
                .entitlementId(payload.entitlementId())
                .issuedAt(payload.issuedAt())
                .build();
    }

    /**
     * @return true if the wallet signature over the message recovers to the address
     */
    public boolean verifyWalletSignature(String address, String message, String signature) {
        return signerIdentity.verifyPersonalMessage(address, message, signature);
    }

    public String getSignerAddress() {
        return signerIdentity.getAddress();
    }

    public DomainParameters getDomainParameters() {
        return domainParameters;
    }

    /**
     * @return true if issued proofs carry an ownership confirmed on the ledger
     */
    public boolean isOwnershipConfirmedOnChain() {
        return applicationProperties.isRequireOnChainConfirmation() && ledgerOracle.isContractConfigured();
    }

    private boolean markUsed(String nonceKey, long expiresAt) {
        try {
            return nonceLedger.tryMarkUsed(nonceKey, expiresAt);
        } catch (DataAccessException e) {
            log.error("Nonce ledger could not record nonce {}", nonceKey, e);
            throw new ProofException(e, ProofError.STORAGE_UNAVAILABLE, "Proof can not be checked for replay right now");
        }
    }

    private static String refusalMessage(ProofError reason, BigInteger entitlementId) {
        return switch (reason) {
            case NOT_OWNER -> "Entitlement " + entitlementId + " is not held by the claimed owner";
            case ALREADY_CONSUMED -> "Entitlement " + entitlementId + " was already used";
            case ENTITLEMENT_NOT_FOUND -> "Entitlement " + entitlementId + " does not exist";
            case ORACLE_UNAVAILABLE -> "Ownership of entitlement " + entitlementId + " can not be checked right now";
            default -> "Entitlement " + entitlementId + " can not be proven";
        };
    }
}
