/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.web.proof;

import ch.admin.bj.swiyu.ticketproof.api.exception.ApiErrorDto;
import ch.admin.bj.swiyu.ticketproof.api.proof.IssueProofRequestDto;
import ch.admin.bj.swiyu.ticketproof.api.proof.SignedProofDto;
import ch.admin.bj.swiyu.ticketproof.api.proof.SignerInfoDto;
import ch.admin.bj.swiyu.ticketproof.api.proof.VerifyProofRequestDto;
import ch.admin.bj.swiyu.ticketproof.api.proof.VerifyProofResponseDto;
import ch.admin.bj.swiyu.ticketproof.infrastructure.config.SessionTokenFilter;
import ch.admin.bj.swiyu.ticketproof.service.ProofService;
import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static ch.admin.bj.swiyu.ticketproof.service.mapper.ProofMapper.toProofPayload;
import static ch.admin.bj.swiyu.ticketproof.service.mapper.ProofMapper.toSignedProofDto;
import static ch.admin.bj.swiyu.ticketproof.service.mapper.ProofMapper.toSignerInfoDto;
import static ch.admin.bj.swiyu.ticketproof.service.mapper.ProofMapper.toVerifyProofResponseDto;

/**
 * Issuance and one time verification of ticket proofs.
 */
@Slf4j
@RestController
@RequestMapping(value = {"/api/v1"})
@AllArgsConstructor
@Tag(name = "Ticket Proofs", description = "Issues short lived signed ticket proofs to ticket holders and verifies " +
        "them exactly once at the entrance")
public class ProofController {

    private final ProofService proofService;

    @Timed
    @PostMapping("/proofs")
    @SecurityRequirement(name = "bearer-jwt")
    @Operation(summary = "Issue a proof that the signed in wallet holds the ticket.",
            description = "The ownership is confirmed on the ledger before signing unless the service runs without " +
                    "a verifying contract. The proof can be used once and only until it expires.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Signed proof"),
                    @ApiResponse(responseCode = "403", description = "The wallet does not hold the ticket",
                            content = @Content(schema = @Schema(implementation = ApiErrorDto.class))),
                    @ApiResponse(responseCode = "503", description = "The ledger could not be asked, retry later",
                            content = @Content(schema = @Schema(implementation = ApiErrorDto.class)))
            })
    public SignedProofDto issueProof(@Valid @RequestBody IssueProofRequestDto request,
                                     @RequestAttribute(SessionTokenFilter.SESSION_ADDRESS_ATTRIBUTE) String sessionAddress) {
        return toSignedProofDto(proofService.issue(request.entitlementId(), sessionAddress));
    }

    @Timed
    @PostMapping("/proofs/verify")
    @Operation(summary = "Verify a presented proof and consume it.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Proof accepted"),
                    @ApiResponse(responseCode = "401", description = "Signature invalid, proof expired or not yet valid",
                            content = @Content(schema = @Schema(implementation = ApiErrorDto.class))),
                    @ApiResponse(responseCode = "409", description = "Proof was already used",
                            content = @Content(schema = @Schema(implementation = ApiErrorDto.class)))
            })
    public VerifyProofResponseDto verifyProof(@Valid @RequestBody VerifyProofRequestDto request) {
        var result = proofService.verify(toProofPayload(request.data()), request.signature());
        return toVerifyProofResponseDto(result);
    }

    @Timed
    @GetMapping("/signer")
    @Operation(summary = "Address and EIP-712 domain the proofs are signed with.")
    public SignerInfoDto getSigner() {
        return toSignerInfoDto(proofService.getSignerAddress(), proofService.getDomainParameters(),
                proofService.isOwnershipConfirmedOnChain());
    }
}
