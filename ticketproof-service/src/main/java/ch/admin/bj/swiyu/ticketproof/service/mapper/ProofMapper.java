/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.mapper;

import ch.admin.bj.swiyu.ticketproof.api.auth.ChallengeDto;
import ch.admin.bj.swiyu.ticketproof.api.auth.SessionDto;
import ch.admin.bj.swiyu.ticketproof.api.exception.ApiErrorDto;
import ch.admin.bj.swiyu.ticketproof.api.exception.ProofErrorDto;
import ch.admin.bj.swiyu.ticketproof.api.proof.OwnershipVerificationDto;
import ch.admin.bj.swiyu.ticketproof.api.proof.ProofPayloadDto;
import ch.admin.bj.swiyu.ticketproof.api.proof.SignedProofDto;
import ch.admin.bj.swiyu.ticketproof.api.proof.SignerInfoDto;
import ch.admin.bj.swiyu.ticketproof.api.proof.VerifyProofResponseDto;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofError;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofException;
import ch.admin.bj.swiyu.ticketproof.domain.proof.DomainParameters;
import ch.admin.bj.swiyu.ticketproof.domain.proof.OwnershipVerification;
import ch.admin.bj.swiyu.ticketproof.domain.proof.ProofPayload;
import ch.admin.bj.swiyu.ticketproof.domain.proof.SignedProof;
import ch.admin.bj.swiyu.ticketproof.domain.proof.VerifyResult;
import ch.admin.bj.swiyu.ticketproof.service.session.SessionToken;
import ch.admin.bj.swiyu.ticketproof.service.session.WalletChallenge;
import lombok.experimental.UtilityClass;

@UtilityClass
public class ProofMapper {

    public static SignedProofDto toSignedProofDto(SignedProof proof) {
        return SignedProofDto.builder()
                .data(toProofPayloadDto(proof.payload()))
                .signature(proof.signature())
                .expiresAt(proof.expiresAt())
                .ownershipVerification(toOwnershipVerificationDto(proof.ownershipVerification()))
                .build();
    }

    public static ProofPayloadDto toProofPayloadDto(ProofPayload payload) {
        return ProofPayloadDto.builder()
                .tokenId(payload.entitlementId())
                .owner(payload.owner())
                .timestamp(payload.issuedAt())
                .nonce(payload.nonce())
                .build();
    }

    public static ProofPayload toProofPayload(ProofPayloadDto dto) {
        return ProofPayload.builder()
                .entitlementId(dto.tokenId())
                .owner(dto.owner())
                .issuedAt(dto.timestamp())
                .nonce(dto.nonce())
                .build();
    }

    public static VerifyProofResponseDto toVerifyProofResponseDto(VerifyResult result) {
        return VerifyProofResponseDto.builder()
                .valid(result.valid())
                .signer(result.signer())
                .owner(result.owner())
                .tokenId(result.entitlementId())
                .timestamp(result.issuedAt())
                .build();
    }

    public static SignerInfoDto toSignerInfoDto(String signerAddress, DomainParameters domain, boolean onChainConfirmation) {
        return SignerInfoDto.builder()
                .address(signerAddress)
                .name(domain.protocolName())
                .version(domain.version())
                .chainId(domain.chainId().longValueExact())
                .verifyingContract(domain.verifyingContract())
                .ownershipVerification(onChainConfirmation ? OwnershipVerificationDto.VERIFIED : OwnershipVerificationDto.UNVERIFIED)
                .build();
    }

    public static ChallengeDto toChallengeDto(WalletChallenge challenge) {
        return ChallengeDto.builder()
                .address(challenge.address())
                .message(challenge.message())
                .nonce(challenge.nonce())
                .issuedAt(challenge.issuedAt())
                .expiresAt(challenge.expiresAt())
                .build();
    }

    public static SessionDto toSessionDto(SessionToken sessionToken) {
        return new SessionDto(sessionToken.token(), sessionToken.address(), sessionToken.expiresAt());
    }

    public static ApiErrorDto toApiErrorDto(ProofException exception) {
        var error = toProofErrorDto(exception.getError());
        return ApiErrorDto.builder()
                .errorCode(error.getErrorCode())
                .errorDescription(exception.getMessage())
                .retryable(exception.getError().isRetryable())
                .context(exception.getContext())
                .status(error.getHttpStatus())
                .build();
    }

    public static ProofErrorDto toProofErrorDto(ProofError error) {
        return switch (error) {
            case MALFORMED_INPUT -> ProofErrorDto.MALFORMED_INPUT;
            case INVALID_SIGNATURE -> ProofErrorDto.INVALID_SIGNATURE;
            case EXPIRED -> ProofErrorDto.EXPIRED;
            case NOT_YET_VALID -> ProofErrorDto.NOT_YET_VALID;
            case REPLAYED_PROOF -> ProofErrorDto.REPLAYED_PROOF;
            case NOT_OWNER -> ProofErrorDto.NOT_OWNER;
            case ALREADY_CONSUMED -> ProofErrorDto.ALREADY_CONSUMED;
            case ENTITLEMENT_NOT_FOUND -> ProofErrorDto.ENTITLEMENT_NOT_FOUND;
            case ORACLE_UNAVAILABLE -> ProofErrorDto.ORACLE_UNAVAILABLE;
            case STORAGE_UNAVAILABLE -> ProofErrorDto.STORAGE_UNAVAILABLE;
        };
    }

    public static OwnershipVerificationDto toOwnershipVerificationDto(OwnershipVerification source) {
        return switch (source) {
            case VERIFIED -> OwnershipVerificationDto.VERIFIED;
            case UNVERIFIED -> OwnershipVerificationDto.UNVERIFIED;
        };
    }
}
