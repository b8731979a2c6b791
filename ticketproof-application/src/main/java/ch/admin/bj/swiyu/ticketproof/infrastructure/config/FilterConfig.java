/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.config;

import ch.admin.bj.swiyu.ticketproof.service.session.SessionTokenService;
import lombok.Data;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
public class FilterConfig {

    // exact match, the verification endpoint below it stays public
    private static final String[] URL_PATTERNS = {
            "/api/v1/proofs",
    };
    private final SessionTokenService sessionTokenService;

    @Bean
    public SessionTokenFilter sessionTokenFilter() {
        return new SessionTokenFilter(sessionTokenService);
    }

    @Bean
    public FilterRegistrationBean<SessionTokenFilter> sessionTokenFilterRegistration(SessionTokenFilter sessionTokenFilter) {
        FilterRegistrationBean<SessionTokenFilter> registrationBean = new FilterRegistrationBean<>();
        registrationBean.setFilter(sessionTokenFilter);
        registrationBean.addUrlPatterns(URL_PATTERNS);
        registrationBean.setOrder(1);
        return registrationBean;
    }
}
