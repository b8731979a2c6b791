/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.oracle;

import ch.admin.bj.swiyu.ticketproof.common.exception.ProofError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Confirms ownership claims against the entitlement contract before a proof is signed.
 * <p>
 * Without a configured contract every claim is accepted unverified. This is only meant for
 * local development and is reported on every call.
 * </p>
 */
@Slf4j
public class LedgerOracle {

    public static final String UNVERIFIED_COUNTER = "ticketproof.oracle.unverified";

    private final EntitlementContract contract;
    private final Counter unverifiedCounter;

    /**
     * @param contract the entitlement contract, null runs the oracle in unverified mode
     */
    public LedgerOracle(EntitlementContract contract, MeterRegistry meterRegistry) {
        this.contract = contract;
        this.unverifiedCounter = Counter.builder(UNVERIFIED_COUNTER)
                .description("Ownership claims accepted without asking the ledger")
                .register(meterRegistry);
    }

    public boolean isContractConfigured() {
        return contract != null;
    }

    public OwnershipCheckResult checkOwnership(BigInteger entitlementId, String claimedOwner) {
        if (contract == null) {
            log.warn("No entitlement contract configured, ownership of entitlement {} by {} is not verified", entitlementId, claimedOwner);
            unverifiedCounter.increment();
            return OwnershipCheckResult.skipped();
        }

        try {
            var actualOwner = contract.ownerOf(entitlementId);
            if (!actualOwner.equalsIgnoreCase(claimedOwner)) {
                log.debug("Entitlement {} is held by {}, not by {}", entitlementId, actualOwner, claimedOwner);
                return OwnershipCheckResult.refused(ProofError.NOT_OWNER, actualOwner);
            }
            if (contract.isUsed(entitlementId)) {
                log.debug("Entitlement {} was already used", entitlementId);
                return OwnershipCheckResult.refused(ProofError.ALREADY_CONSUMED, actualOwner);
            }
            return OwnershipCheckResult.confirmed(actualOwner);
        } catch (LedgerCallException e) {
            if (e.isEntitlementMissing()) {
                log.debug("Entitlement {} does not exist: {}", entitlementId, e.getMessage());
                return OwnershipCheckResult.refused(ProofError.ENTITLEMENT_NOT_FOUND, null);
            }
            log.warn("Ownership of entitlement {} could not be checked: {}", entitlementId, e.getMessage());
            return OwnershipCheckResult.refused(ProofError.ORACLE_UNAVAILABLE, null);
        }
    }

    /**
     * Asks the node for its latest block.
     *
     * @return the latest block number
     * @throws LedgerCallException if the node is not reachable
     * @throws IllegalStateException if no contract is configured
     */
    public BigInteger latestBlockNumber() {
        if (contract == null) {
            throw new IllegalStateException("No entitlement contract configured");
        }
        return contract.latestBlockNumber();
    }
}
