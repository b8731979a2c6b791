/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Properties which may be shown unmasked on the actuator env endpoint.
 */
@Getter
@Setter
@ConfigurationProperties("management.endpoint.env")
public class ActuatorEnvProperties {
    private List<String> allowedProperties = List.of();
}
