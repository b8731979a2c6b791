/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service;

import ch.admin.bj.swiyu.ticketproof.common.config.ApplicationProperties;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofError;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofException;
import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedger;
import ch.admin.bj.swiyu.ticketproof.domain.proof.IssuancePolicy;
import ch.admin.bj.swiyu.ticketproof.domain.proof.OwnershipVerification;
import ch.admin.bj.swiyu.ticketproof.domain.proof.ProofNonce;
import ch.admin.bj.swiyu.ticketproof.service.ledger.InMemoryNonceLedger;
import ch.admin.bj.swiyu.ticketproof.service.oracle.EntitlementContract;
import ch.admin.bj.swiyu.ticketproof.service.oracle.LedgerCallException;
import ch.admin.bj.swiyu.ticketproof.service.oracle.LedgerOracle;
import ch.admin.bj.swiyu.ticketproof.service.oracle.Web3EntitlementContract;
import ch.admin.bj.swiyu.ticketproof.test.MutableClock;
import ch.admin.bj.swiyu.ticketproof.test.TestKeys;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.web3j.protocol.Web3j;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ProofServiceTest {

    private static final long NOW = 1_700_000_000L;
    private static final BigInteger ENTITLEMENT = BigInteger.valueOf(42);

    private MutableClock clock;
    private ApplicationProperties applicationProperties;
    private EntitlementContract contract;
    private InMemoryNonceLedger nonceLedger;
    private SignerIdentity signerIdentity;
    private ProofService proofService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        applicationProperties = new ApplicationProperties();
        applicationProperties.setSignerPrivateKey(TestKeys.SIGNER_PRIVATE_KEY);
        contract = mock(EntitlementContract.class);
        nonceLedger = new InMemoryNonceLedger(clock);
        var codec = TestKeys.codec();
        signerIdentity = new SignerIdentity(TestKeys.SIGNER_PRIVATE_KEY, codec);
        proofService = createService(new LedgerOracle(contract, new SimpleMeterRegistry()), nonceLedger);
    }

    @Test
    void issueThenVerify_succeedsExactlyOnce() {
        ownedByHolder();
        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);

        var result = proofService.verify(proof.payload(), proof.signature());

        assertTrue(result.valid());
        assertThat(result.signer()).isEqualToIgnoringCase(TestKeys.SIGNER_ADDRESS);
        assertEquals(TestKeys.HOLDER_ADDRESS, result.owner());
        assertEquals(ENTITLEMENT, result.entitlementId());
        assertEquals(NOW, result.issuedAt());
        assertError(ProofError.REPLAYED_PROOF, () -> proofService.verify(proof.payload(), proof.signature()));
    }

    @Test
    void issue_setsExpiryAndFreshNonce() {
        ownedByHolder();

        var first = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);
        var second = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);

        assertEquals(NOW, first.payload().issuedAt());
        assertEquals(NOW + 60, first.expiresAt());
        assertEquals(OwnershipVerification.VERIFIED, first.ownershipVerification());
        assertThat(first.payload().nonce()).isNotEqualTo(second.payload().nonce());
        assertThat(new ProofNonce(first.payload().nonce()).getIdentifier()).matches("^0x[0-9a-f]{64}$");
    }

    @Test
    void issue_writesNothingToNonceLedger() {
        var ledger = mock(NonceLedger.class);
        var service = createService(new LedgerOracle(null, new SimpleMeterRegistry()), ledger);

        service.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);

        verifyNoInteractions(ledger);
    }

    @Test
    void verify_tamperedField_invalidSignature() {
        ownedByHolder();
        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);
        var payload = proof.payload();

        assertError(ProofError.INVALID_SIGNATURE, () -> proofService.verify(payload.toBuilder().entitlementId(BigInteger.valueOf(43)).build(), proof.signature()));
        assertError(ProofError.INVALID_SIGNATURE, () -> proofService.verify(payload.toBuilder().owner(TestKeys.OTHER_ADDRESS).build(), proof.signature()));
        assertError(ProofError.INVALID_SIGNATURE, () -> proofService.verify(payload.toBuilder().issuedAt(NOW - 1).build(), proof.signature()));
        assertError(ProofError.INVALID_SIGNATURE, () -> proofService.verify(payload.toBuilder().nonce(payload.nonce().add(BigInteger.ONE)).build(), proof.signature()));

        // the genuine proof is still unused
        assertTrue(proofService.verify(payload, proof.signature()).valid());
    }

    @Test
    void verify_malformedSignature_invalidSignature() {
        ownedByHolder();
        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);

        assertError(ProofError.INVALID_SIGNATURE, () -> proofService.verify(proof.payload(), "0x1234"));
        assertError(ProofError.INVALID_SIGNATURE, () -> proofService.verify(proof.payload(), null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1b", "1c"})
    void verify_unrecoverableSignature_invalidSignatureAndNonceUntouched(String recoveryId) {
        ownedByHolder();
        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);

        assertError(ProofError.INVALID_SIGNATURE,
                () -> proofService.verify(proof.payload(), TestKeys.signatureWithROfCurveOrder(recoveryId)));
        assertTrue(proofService.verify(proof.payload(), proof.signature()).valid());
    }

    @Test
    void verify_signedByOtherKey_invalidSignature() {
        var otherSigner = new SignerIdentity(TestKeys.HOLDER_PRIVATE_KEY, TestKeys.codec());
        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS, IssuancePolicy.unconfirmed());
        var forged = otherSigner.sign(TestKeys.domain(), proof.payload());

        assertError(ProofError.INVALID_SIGNATURE, () -> proofService.verify(proof.payload(), forged));
    }

    @Test
    void verify_validityWindow() {
        ownedByHolder();
        var tooLate = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);
        var justInTime = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);

        clock.setEpochSeconds(NOW + 61);
        assertError(ProofError.EXPIRED, () -> proofService.verify(tooLate.payload(), tooLate.signature()));

        clock.setEpochSeconds(NOW + 59);
        assertTrue(proofService.verify(justInTime.payload(), justInTime.signature()).valid());
    }

    @Test
    void verify_exactlyAtValidityEnd_accepted() {
        ownedByHolder();
        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);

        clock.setEpochSeconds(NOW + 60);

        assertTrue(proofService.verify(proof.payload(), proof.signature()).valid());
    }

    @Test
    void verify_issuedInFuture_toleratesSkew() {
        ownedByHolder();
        clock.setEpochSeconds(NOW + 5);
        var withinSkew = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);
        clock.setEpochSeconds(NOW + 6);
        var beyondSkew = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);

        clock.setEpochSeconds(NOW);

        assertTrue(proofService.verify(withinSkew.payload(), withinSkew.signature()).valid());
        assertError(ProofError.NOT_YET_VALID, () -> proofService.verify(beyondSkew.payload(), beyondSkew.signature()));
    }

    @Test
    void verify_expiredProof_doesNotConsumeNonce() {
        ownedByHolder();
        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);
        clock.setEpochSeconds(NOW + 61);

        assertError(ProofError.EXPIRED, () -> proofService.verify(proof.payload(), proof.signature()));

        assertFalse(nonceLedger.isUsed(new ProofNonce(proof.payload().nonce()).getIdentifier()));
    }

    @Test
    void verify_recordsNonceUntilRetentionEnd() {
        ownedByHolder();
        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);
        var nonceKey = new ProofNonce(proof.payload().nonce()).getIdentifier();

        proofService.verify(proof.payload(), proof.signature());

        clock.setEpochSeconds(NOW + 300);
        assertTrue(nonceLedger.isUsed(nonceKey));
        clock.setEpochSeconds(NOW + 301);
        assertFalse(nonceLedger.isUsed(nonceKey));
    }

    @Test
    void verify_concurrentPresentations_exactlyOneSucceeds() throws Exception {
        ownedByHolder();
        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);
        var threads = 16;
        var executor = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<ProofError>>();
            for (int i = 0; i < threads; i++) {
                Callable<ProofError> task = () -> {
                    start.await();
                    try {
                        proofService.verify(proof.payload(), proof.signature());
                        return null;
                    } catch (ProofException e) {
                        return e.getError();
                    }
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            var successes = 0;
            var replays = 0;
            for (var future : futures) {
                var error = future.get(30, TimeUnit.SECONDS);
                if (error == null) {
                    successes++;
                } else if (error == ProofError.REPLAYED_PROOF) {
                    replays++;
                }
            }
            assertEquals(1, successes);
            assertEquals(threads - 1, replays);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void verify_ledgerFailure_storageUnavailable() {
        var ledger = mock(NonceLedger.class);
        when(ledger.tryMarkUsed(anyString(), anyLong())).thenThrow(new RedisConnectionFailureException("down"));
        var service = createService(new LedgerOracle(null, new SimpleMeterRegistry()), ledger);
        var proof = service.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);

        assertError(ProofError.STORAGE_UNAVAILABLE, () -> service.verify(proof.payload(), proof.signature()));
    }

    @Test
    void verify_outOfRangePayload_malformedInput() {
        ownedByHolder();
        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);
        var payload = proof.payload().toBuilder().nonce(BigInteger.TWO.pow(256)).build();

        assertError(ProofError.MALFORMED_INPUT, () -> proofService.verify(payload, proof.signature()));
    }

    @Test
    void issue_noContract_unverified() {
        var service = createService(new LedgerOracle(null, new SimpleMeterRegistry()), nonceLedger);

        var proof = service.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);

        assertEquals(OwnershipVerification.UNVERIFIED, proof.ownershipVerification());
        assertTrue(service.verify(proof.payload(), proof.signature()).valid());
    }

    @Test
    void issue_policyWithoutConfirmation_skipsOracle() {
        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS, IssuancePolicy.unconfirmed());

        assertEquals(OwnershipVerification.UNVERIFIED, proof.ownershipVerification());
        verifyNoInteractions(contract);
    }

    @Test
    void issue_configuredPolicyWithoutConfirmation_skipsOracle() {
        applicationProperties.setRequireOnChainConfirmation(false);

        var proof = proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS);

        assertEquals(OwnershipVerification.UNVERIFIED, proof.ownershipVerification());
        verifyNoInteractions(contract);
    }

    @Test
    void issue_otherOwner_notOwnerAndNothingSigned() {
        when(contract.ownerOf(ENTITLEMENT)).thenReturn(TestKeys.OTHER_ADDRESS);

        assertThatThrownBy(() -> proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS))
                .isInstanceOf(ProofException.class)
                .satisfies(e -> {
                    var proofException = (ProofException) e;
                    assertEquals(ProofError.NOT_OWNER, proofException.getError());
                    assertEquals(TestKeys.OTHER_ADDRESS, proofException.getContext().get("actualOwner"));
                });
    }

    @Test
    void issue_oracleFailures_mappedToReason() {
        when(contract.ownerOf(ENTITLEMENT)).thenReturn(TestKeys.HOLDER_ADDRESS);
        when(contract.isUsed(ENTITLEMENT)).thenReturn(true);
        assertError(ProofError.ALREADY_CONSUMED, () -> proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS));

        doThrow(new LedgerCallException("nonexistent token", true)).when(contract).ownerOf(ENTITLEMENT);
        assertError(ProofError.ENTITLEMENT_NOT_FOUND, () -> proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS));

        doThrow(new LedgerCallException("timeout", new RuntimeException())).when(contract).ownerOf(ENTITLEMENT);
        assertError(ProofError.ORACLE_UNAVAILABLE, () -> proofService.issue(ENTITLEMENT, TestKeys.HOLDER_ADDRESS));
    }

    @Test
    void issue_malformedOwner_rejectedBeforeOracle() {
        assertError(ProofError.MALFORMED_INPUT, () -> proofService.issue(ENTITLEMENT, "0x1234"));
        assertError(ProofError.MALFORMED_INPUT, () -> proofService.issue(null, TestKeys.HOLDER_ADDRESS));
        verifyNoInteractions(contract);
    }

    @Test
    void issue_entitlementIdBeyondUint256_rejectedBeforeLedgerCall() {
        var web3j = mock(Web3j.class);
        var ledgerContract = new Web3EntitlementContract(web3j, TestKeys.CONTRACT_ADDRESS, Duration.ofSeconds(5));
        var service = createService(new LedgerOracle(ledgerContract, new SimpleMeterRegistry()), nonceLedger);

        assertError(ProofError.MALFORMED_INPUT, () -> service.issue(BigInteger.TWO.pow(256), TestKeys.HOLDER_ADDRESS));
        assertError(ProofError.MALFORMED_INPUT, () -> service.issue(BigInteger.valueOf(-1), TestKeys.HOLDER_ADDRESS));
        assertError(ProofError.MALFORMED_INPUT,
                () -> service.issue(BigInteger.TWO.pow(256), TestKeys.HOLDER_ADDRESS, IssuancePolicy.unconfirmed()));
        verifyNoInteractions(web3j);
    }

    @Test
    void verifyWalletSignature_unrecoverableSignature_false() {
        assertFalse(proofService.verifyWalletSignature(TestKeys.HOLDER_ADDRESS, "hello", TestKeys.signatureWithROfCurveOrder("1b")));
        assertFalse(proofService.verifyWalletSignature(TestKeys.HOLDER_ADDRESS, "hello", TestKeys.signatureWithROfCurveOrder("1c")));
    }

    @Test
    void verifyWalletSignature_delegatesToSigner() {
        var message = "hello";
        var signature = SignerIdentityTest.personalSign(message, TestKeys.HOLDER_PRIVATE_KEY);

        assertTrue(proofService.verifyWalletSignature(TestKeys.HOLDER_ADDRESS.toLowerCase(), message, signature));
        assertFalse(proofService.verifyWalletSignature(TestKeys.OTHER_ADDRESS, message, signature));
    }

    @Test
    void getSignerAddress_returnsConfiguredSigner() {
        assertEquals(TestKeys.SIGNER_ADDRESS, proofService.getSignerAddress());
        assertEquals(TestKeys.domain(), proofService.getDomainParameters());
    }

    private ProofService createService(LedgerOracle oracle, NonceLedger ledger) {
        return new ProofService(applicationProperties, TestKeys.domain(), TestKeys.codec(), signerIdentity,
                oracle, ledger, clock, new SecureRandom());
    }

    private void ownedByHolder() {
        when(contract.ownerOf(ENTITLEMENT)).thenReturn(TestKeys.HOLDER_ADDRESS);
        when(contract.isUsed(ENTITLEMENT)).thenReturn(false);
    }

    private static void assertError(ProofError expected, Runnable call) {
        assertThatThrownBy(call::run)
                .isInstanceOf(ProofException.class)
                .extracting(e -> ((ProofException) e).getError())
                .isEqualTo(expected);
    }
}
