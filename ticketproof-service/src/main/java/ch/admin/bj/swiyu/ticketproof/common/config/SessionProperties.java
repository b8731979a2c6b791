/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.common.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Wallet session configuration.
 *
 * @param secret            HMAC secret for session tokens, at least 32 characters for HS256
 * @param tokenTtl          lifetime of a session token
 * @param challengeTtl      how long a sign-in challenge message may be used
 * @param challengePrefix   human readable first line of the sign-in challenge
 * @param maxOpenChallenges upper bound of sign-in challenges held at the same time
 */
@Validated
@ConfigurationProperties(prefix = "application.session")
public record SessionProperties(
        @NotBlank @Size(min = 32) String secret,
        @NotNull Duration tokenTtl,
        @NotNull Duration challengeTtl,
        @NotBlank String challengePrefix,
        @DefaultValue("10000") @Positive int maxOpenChallenges) {
}
