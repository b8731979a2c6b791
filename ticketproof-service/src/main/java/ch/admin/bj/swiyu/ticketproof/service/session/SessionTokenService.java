/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service.session;

import ch.admin.bj.swiyu.ticketproof.common.config.SessionProperties;
import ch.admin.bj.swiyu.ticketproof.common.exception.ConfigurationException;
import ch.admin.bj.swiyu.ticketproof.common.exception.SessionException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.util.Date;
import java.util.Locale;
import java.util.UUID;

/**
 * Short lived HS256 session tokens for wallets which proved control of their address.
 */
@Slf4j
@Service
public class SessionTokenService {

    static final String ISSUER = "ticketproof";

    private final SessionProperties sessionProperties;
    private final Clock clock;
    private final JWSSigner signer;
    private final JWSVerifier verifier;

    public SessionTokenService(SessionProperties sessionProperties, Clock clock) {
        this.sessionProperties = sessionProperties;
        this.clock = clock;
        var secret = sessionProperties.secret().getBytes(StandardCharsets.UTF_8);
        try {
            this.signer = new MACSigner(secret);
            this.verifier = new MACVerifier(secret);
        } catch (JOSEException e) {
            throw new ConfigurationException("application.session.secret is not usable for HS256", e);
        }
    }

    public SessionToken issue(String address) {
        var subject = address.toLowerCase(Locale.ROOT);
        var now = clock.instant();
        var expiresAt = now.plus(sessionProperties.tokenTtl());
        var claims = new JWTClaimsSet.Builder()
                .issuer(ISSUER)
                .subject(subject)
                .jwtID(UUID.randomUUID().toString())
                .issueTime(Date.from(now))
                .expirationTime(Date.from(expiresAt))
                .build();
        var jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new IllegalStateException("Session token could not be signed", e);
        }
        return new SessionToken(jwt.serialize(), subject, expiresAt.getEpochSecond());
    }

    /**
     * @return the lower case wallet address of the session
     * @throws SessionException if the token is not a valid, unexpired session token of this service
     */
    public String verify(String token) {
        if (token == null || token.isBlank()) {
            throw new SessionException("Session token is missing");
        }
        try {
            var jwt = SignedJWT.parse(token);
            if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm()) || !jwt.verify(verifier)) {
                throw new SessionException("Session token signature is not valid");
            }
            var claims = jwt.getJWTClaimsSet();
            if (!ISSUER.equals(claims.getIssuer()) || claims.getSubject() == null) {
                throw new SessionException("Session token was not issued by this service");
            }
            if (claims.getExpirationTime() == null || !claims.getExpirationTime().toInstant().isAfter(clock.instant())) {
                throw new SessionException("Session token expired");
            }
            return claims.getSubject();
        } catch (ParseException | JOSEException e) {
            log.debug("Session token could not be read: {}", e.getMessage());
            throw new SessionException("Session token is malformed", e);
        }
    }
}
