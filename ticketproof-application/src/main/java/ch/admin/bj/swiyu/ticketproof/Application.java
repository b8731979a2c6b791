/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;

@SpringBootApplication
@EnableConfigurationProperties
@ConfigurationPropertiesScan
@EnableScheduling
@Slf4j
public class Application {

    public static void main(String[] args) {
        Environment env = SpringApplication.run(Application.class, args).getEnvironment();
        var contract = env.getProperty("application.ledger.verifying-contract");
        log.info(
                """

                        ============================================================================
                        \tTicket proof service '{}' started on port {}
                        \tProfiles:            {}
                        \tEIP-712 domain:      {} v{} on chain {}
                        \tEntitlement ledger:  {} at {}
                        \tAPI documentation:   http://localhost:{}/swagger-ui.html
                        ============================================================================""",
                env.getProperty("spring.application.name"),
                env.getProperty("server.port", "8080"),
                Arrays.toString(env.getActiveProfiles()),
                env.getProperty("application.domain.protocol-name"),
                env.getProperty("application.domain.version"),
                env.getProperty("application.domain.chain-id"),
                StringUtils.defaultIfBlank(contract, "none (ownership unverified)"),
                env.getProperty("application.ledger.rpc-url"),
                env.getProperty("server.port", "8080")
        );
    }
}
