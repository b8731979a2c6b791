/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.web;

import ch.admin.bj.swiyu.ticketproof.api.exception.ApiErrorDto;
import ch.admin.bj.swiyu.ticketproof.common.exception.ConfigurationException;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofException;
import ch.admin.bj.swiyu.ticketproof.common.exception.SessionException;
import jakarta.validation.ConstraintViolationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.stream.Collectors;
import java.util.stream.Stream;

import static ch.admin.bj.swiyu.ticketproof.service.mapper.ProofMapper.toApiErrorDto;
import static org.springframework.http.HttpStatus.INTERNAL_SERVER_ERROR;
import static org.springframework.http.HttpStatus.UNAUTHORIZED;
import static org.springframework.http.HttpStatus.UNPROCESSABLE_ENTITY;

@RestControllerAdvice
@Slf4j
public class DefaultExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(ProofException.class)
    public ResponseEntity<ApiErrorDto> handleProofException(final ProofException exception) {
        var apiError = toApiErrorDto(exception);
        if (exception.getError().isRetryable()) {
            log.warn("ProofException: {} - {}", exception.getError(), exception.getMessage());
        } else {
            log.debug("ProofException: {} - {}", exception.getError(), exception.getMessage());
        }
        return new ResponseEntity<>(apiError, apiError.getStatus());
    }

    @ExceptionHandler(SessionException.class)
    public ResponseEntity<ApiErrorDto> handleSessionException(final SessionException exception) {
        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorCode("invalid_session")
                .errorDescription(UNAUTHORIZED.getReasonPhrase())
                .errorDetails(exception.getMessage())
                .status(UNAUTHORIZED)
                .build();
        log.debug("Session rejected: {}", exception.getMessage());
        return new ResponseEntity<>(apiError, apiError.getStatus());
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiErrorDto> handleConfigurationException(final Exception exception) {
        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorDescription(INTERNAL_SERVER_ERROR.getReasonPhrase())
                .errorDetails(exception.getMessage())
                .status(INTERNAL_SERVER_ERROR)
                .build();
        log.error("Configuration Exception intercepted", exception);
        return new ResponseEntity<>(apiError, apiError.getStatus());
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Object> handleConstraintViolationException(final Exception exception) {
        return handleUnprocessableEntity(exception.getMessage());
    }

    @ExceptionHandler
    public ResponseEntity<ApiErrorDto> handle(final Exception exception) {
        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorDescription(INTERNAL_SERVER_ERROR.getReasonPhrase())
                .status(INTERNAL_SERVER_ERROR)
                .build();

        log.error("Unknown Exception occurred", exception);
        return new ResponseEntity<>(apiError, apiError.getStatus());
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(@NonNull MethodArgumentNotValidException ex,
                                                                  @NonNull HttpHeaders headers,
                                                                  @NonNull HttpStatusCode status,
                                                                  @NonNull WebRequest request) {

        String errors = Stream.concat(
                        ex.getBindingResult().getFieldErrors()
                                .stream().map(error -> String.format("%s: %s", error.getField(), error.getDefaultMessage())),
                        ex.getBindingResult().getGlobalErrors().stream().map(error -> String.format("%s: %s", error.getObjectName(), error.getDefaultMessage()))
                ).sorted()
                .collect(Collectors.joining(", "));

        return handleUnprocessableEntity(errors);
    }

    private ResponseEntity<Object> handleUnprocessableEntity(String errors) {
        log.info("Received bad request. Details: {}", errors);

        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorDescription(UNPROCESSABLE_ENTITY.getReasonPhrase())
                .errorDetails(errors)
                .status(UNPROCESSABLE_ENTITY)
                .build();

        return new ResponseEntity<>(apiError, HttpStatus.UNPROCESSABLE_ENTITY);
    }
}
