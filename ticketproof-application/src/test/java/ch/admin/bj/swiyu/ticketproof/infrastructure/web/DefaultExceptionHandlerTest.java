/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.web;

import ch.admin.bj.swiyu.ticketproof.common.exception.ConfigurationException;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofError;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofException;
import ch.admin.bj.swiyu.ticketproof.common.exception.SessionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.http.HttpStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class DefaultExceptionHandlerTest {

    private final DefaultExceptionHandler handler = new DefaultExceptionHandler();

    @ParameterizedTest
    @EnumSource(ProofError.class)
    void handleProofException_everyErrorHasStatusAndCode(ProofError error) {
        var response = handler.handleProofException(new ProofException(error, "test"));

        assertNotNull(response.getBody());
        assertEquals(error.getCode(), response.getBody().getErrorCode());
        assertEquals(error.isRetryable(), response.getBody().getRetryable());
        assertEquals(response.getStatusCode(), response.getBody().getStatus());
    }

    @Test
    void handleProofException_replayIsConflict() {
        var response = handler.handleProofException(new ProofException(ProofError.REPLAYED_PROOF, "used"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
    }

    @Test
    void handleSessionException_isUnauthorized() {
        var response = handler.handleSessionException(new SessionException("Session token expired"));

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
        assertEquals("invalid_session", response.getBody().getErrorCode());
        assertEquals("Session token expired", response.getBody().getErrorDetails());
    }

    @Test
    void handleConfigurationException_isInternalError() {
        var response = handler.handleConfigurationException(new ConfigurationException("broken"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
    }

    @Test
    void handleUnknownException_doesNotLeakMessage() {
        var response = handler.handle(new IllegalStateException("internal detail"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertNull(response.getBody().getErrorDetails());
    }
}
