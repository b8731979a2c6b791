/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.session;

import ch.admin.bj.swiyu.ticketproof.common.config.SessionProperties;
import ch.admin.bj.swiyu.ticketproof.common.date.TimeUtils;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofError;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofException;
import ch.admin.bj.swiyu.ticketproof.common.exception.SessionException;
import ch.admin.bj.swiyu.ticketproof.service.ProofCodec;
import ch.admin.bj.swiyu.ticketproof.service.ProofService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wallet sign-in: hands out a challenge message and exchanges a wallet signature over it for a session token.
 * Open challenges are held per process and looked up by their message, so several challenges of one address
 * can be open at the same time. The number of open challenges is bounded by configuration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalletChallengeService {

    private static final int CHALLENGE_NONCE_BYTES = 16;

    // keyed by challenge message
    private final Map<String, WalletChallenge> openChallenges = new ConcurrentHashMap<>();

    private final SessionProperties sessionProperties;
    private final ProofService proofService;
    private final SessionTokenService sessionTokenService;
    private final SecureRandom secureRandom;
    private final Clock clock;

    public WalletChallenge createChallenge(String address) {
        if (!ProofCodec.isAddress(address)) {
            throw ProofException.malformedInput("Address must be a 0x prefixed 20 byte address");
        }
        ensureCapacity();
        var key = address.toLowerCase(Locale.ROOT);
        var nonceBytes = new byte[CHALLENGE_NONCE_BYTES];
        secureRandom.nextBytes(nonceBytes);
        var nonce = Numeric.toHexStringNoPrefix(nonceBytes);
        var issuedAt = TimeUtils.nowEpochSeconds(clock);

        var message = String.format("%s%n%nAddress: %s%nNonce: %s%nIssued At: %s",
                sessionProperties.challengePrefix(), key, nonce, TimeUtils.epochSecondsToISO8601(issuedAt));
        var challenge = new WalletChallenge(key, message, nonce, issuedAt, issuedAt + sessionProperties.challengeTtl().toSeconds());
        openChallenges.put(message, challenge);
        return challenge;
    }

    /**
     * Consumes the open challenge with the given message if it was issued to the address and the signature
     * recovers to the address.
     *
     * @throws SessionException if no matching challenge is open or the signature does not match
     */
    public SessionToken login(String address, String message, String signature) {
        if (address == null || message == null) {
            throw new SessionException("Address and message are required");
        }
        var key = address.toLowerCase(Locale.ROOT);
        var challenge = openChallenges.get(message);
        if (challenge == null || !challenge.address().equals(key)) {
            throw new SessionException("No open sign-in challenge for " + key);
        }
        if (challenge.isExpired(TimeUtils.nowEpochSeconds(clock))) {
            openChallenges.remove(message, challenge);
            throw new SessionException("Sign-in challenge expired");
        }
        if (!proofService.verifyWalletSignature(key, message, signature)) {
            log.debug("Wallet signature for {} did not match", key);
            throw new SessionException("Wallet signature is not valid");
        }
        // concurrent logins with the same signature, only the first one gets a session
        if (!openChallenges.remove(message, challenge)) {
            throw new SessionException("Sign-in challenge was already used");
        }
        log.info("Wallet {} signed in", key);
        return sessionTokenService.issue(key);
    }

    /**
     * @return number of removed expired challenges
     */
    public int sweepExpiredChallenges() {
        var now = TimeUtils.nowEpochSeconds(clock);
        var removed = 0;
        for (var entry : openChallenges.entrySet()) {
            if (entry.getValue().isExpired(now) && openChallenges.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    private void ensureCapacity() {
        if (openChallenges.size() < sessionProperties.maxOpenChallenges()) {
            return;
        }
        var removed = sweepExpiredChallenges();
        if (openChallenges.size() >= sessionProperties.maxOpenChallenges()) {
            log.warn("Refusing sign-in challenge, {} challenges are open", openChallenges.size());
            throw new ProofException(ProofError.STORAGE_UNAVAILABLE, "Too many open sign-in challenges, retry later");
        }
        log.debug("Swept {} expired sign-in challenges to make room", removed);
    }

    int openChallengeCount() {
        return openChallenges.size();
    }
}
