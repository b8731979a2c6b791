/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.config;

import ch.admin.bj.swiyu.ticketproof.common.exception.SessionException;
import ch.admin.bj.swiyu.ticketproof.service.session.SessionTokenService;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.io.IOException;

/**
 * Requires a wallet session token on the filtered routes and exposes the wallet address of the session
 * as request attribute {@value #SESSION_ADDRESS_ATTRIBUTE}.
 */
@Slf4j
@AllArgsConstructor
public class SessionTokenFilter implements Filter {

    public static final String SESSION_ADDRESS_ATTRIBUTE = "ticketproof.sessionAddress";
    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionTokenService sessionTokenService;

    @Override
    public void doFilter(ServletRequest servletRequest, ServletResponse servletResponse, FilterChain filterChain)
            throws IOException, ServletException {

        HttpServletResponse response = (HttpServletResponse) servletResponse;
        HttpServletRequest request = (HttpServletRequest) servletRequest;

        var authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Access token required");
            return;
        }

        String address;
        try {
            address = sessionTokenService.verify(authorization.substring(BEARER_PREFIX.length()).trim());
        } catch (SessionException e) {
            // filters are not covered by the default exception handler
            response.sendError(HttpServletResponse.SC_UNAUTHORIZED, e.getMessage());
            return;
        }
        request.setAttribute(SESSION_ADDRESS_ATTRIBUTE, address);
        filterChain.doFilter(request, response);
    }
}
