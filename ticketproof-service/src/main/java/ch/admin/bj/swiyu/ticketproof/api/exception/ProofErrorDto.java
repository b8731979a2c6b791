/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.api.exception;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@Schema(name = "ProofError", enumAsRef = true)
public enum ProofErrorDto {
    MALFORMED_INPUT("malformed_input", HttpStatus.BAD_REQUEST),
    INVALID_SIGNATURE("invalid_signature", HttpStatus.UNAUTHORIZED),
    EXPIRED("expired", HttpStatus.UNAUTHORIZED),
    NOT_YET_VALID("not_yet_valid", HttpStatus.UNAUTHORIZED),
    REPLAYED_PROOF("replayed_proof", HttpStatus.CONFLICT),
    NOT_OWNER("not_owner", HttpStatus.FORBIDDEN),
    ALREADY_CONSUMED("already_consumed", HttpStatus.CONFLICT),
    ENTITLEMENT_NOT_FOUND("entitlement_not_found", HttpStatus.NOT_FOUND),
    ORACLE_UNAVAILABLE("oracle_unavailable", HttpStatus.SERVICE_UNAVAILABLE),
    STORAGE_UNAVAILABLE("storage_unavailable", HttpStatus.SERVICE_UNAVAILABLE);

    private final String errorCode;
    private final HttpStatus httpStatus;

    ProofErrorDto(String errorCode, HttpStatus httpStatus) {
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    @Override
    public String toString() {
        return this.errorCode;
    }
}
