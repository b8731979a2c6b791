/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.common.exception;

import lombok.Getter;

import java.io.Serial;
import java.util.Map;

/**
 * Terminal outcome of a proof issuance or verification, carrying the typed {@link ProofError}.
 */
@Getter
public class ProofException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final ProofError error;
    private final transient Map<String, Object> context;

    public ProofException(ProofError error, String message) {
        super(message);
        this.error = error;
        this.context = Map.of();
    }

    public ProofException(ProofError error, String message, Map<String, Object> context) {
        super(message);
        this.error = error;
        this.context = context == null || context.isEmpty() ? Map.of() : Map.copyOf(context);
    }

    public ProofException(Throwable cause, ProofError error, String message) {
        super(message, cause);
        this.error = error;
        this.context = Map.of();
    }

    public static ProofException malformedInput(String detailMessage) {
        return new ProofException(ProofError.MALFORMED_INPUT, detailMessage);
    }

    public static ProofException invalidSignature() {
        // no detail on which part of the proof failed
        return new ProofException(ProofError.INVALID_SIGNATURE, "Proof signature is not valid");
    }
}
