/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.web.auth;

import ch.admin.bj.swiyu.ticketproof.api.auth.ChallengeDto;
import ch.admin.bj.swiyu.ticketproof.api.auth.LoginRequestDto;
import ch.admin.bj.swiyu.ticketproof.api.auth.SessionDto;
import ch.admin.bj.swiyu.ticketproof.api.auth.WalletSignatureRequestDto;
import ch.admin.bj.swiyu.ticketproof.api.auth.WalletSignatureResponseDto;
import ch.admin.bj.swiyu.ticketproof.service.ProofService;
import ch.admin.bj.swiyu.ticketproof.service.session.WalletChallengeService;
import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import static ch.admin.bj.swiyu.ticketproof.service.mapper.ProofMapper.toChallengeDto;
import static ch.admin.bj.swiyu.ticketproof.service.mapper.ProofMapper.toSessionDto;

@RestController
@RequestMapping(value = {"/api/v1"})
@AllArgsConstructor
@Tag(name = "Wallet Authentication", description = "Wallet sign-in with a personal_sign signature over a one time " +
        "challenge and plain wallet signature checks")
public class AuthController {

    private final WalletChallengeService walletChallengeService;
    private final ProofService proofService;

    @Timed
    @GetMapping("/auth/challenge")
    @Operation(summary = "Create a sign-in challenge for the wallet address.")
    public ChallengeDto getChallenge(@RequestParam String address) {
        return toChallengeDto(walletChallengeService.createChallenge(address));
    }

    @Timed
    @PostMapping("/auth/login")
    @Operation(summary = "Exchange the signed challenge for a session token.")
    public SessionDto login(@Valid @RequestBody LoginRequestDto request) {
        return toSessionDto(walletChallengeService.login(request.address(), request.message(), request.signature()));
    }

    @Timed
    @PostMapping("/wallet-signatures/verify")
    @Operation(summary = "Check whether a personal_sign signature over the message was created by the address.")
    public WalletSignatureResponseDto verifyWalletSignature(@Valid @RequestBody WalletSignatureRequestDto request) {
        return new WalletSignatureResponseDto(
                proofService.verifyWalletSignature(request.address(), request.message(), request.signature()));
    }
}
