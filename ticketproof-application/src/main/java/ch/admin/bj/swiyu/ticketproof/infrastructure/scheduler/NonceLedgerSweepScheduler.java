/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.scheduler;

import ch.admin.bj.swiyu.ticketproof.domain.ledger.NonceLedger;
import ch.admin.bj.swiyu.ticketproof.service.session.WalletChallengeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes expired nonce records and sign-in challenges on a fixed delay, independent of request traffic.
 * Each instance sweeps its own in-process state; the durable ledger expires its records natively.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NonceLedgerSweepScheduler {

    private final NonceLedger nonceLedger;
    private final WalletChallengeService walletChallengeService;

    @Scheduled(initialDelayString = "${application.nonce-ledger.sweep-interval}",
            fixedDelayString = "${application.nonce-ledger.sweep-interval}")
    public void sweep() {
        var removedNonces = nonceLedger.sweepExpired();
        var removedChallenges = walletChallengeService.sweepExpiredChallenges();
        if (removedNonces > 0 || removedChallenges > 0) {
            log.info("Swept {} expired nonce records and {} expired sign-in challenges", removedNonces, removedChallenges);
        }
    }
}
