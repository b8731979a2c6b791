/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.infrastructure.env;

import ch.admin.bj.swiyu.ticketproof.infrastructure.config.ActuatorEnvProperties;
import org.springframework.boot.actuate.endpoint.SanitizableData;
import org.springframework.boot.actuate.endpoint.SanitizingFunction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks values on the actuator env endpoint unless their key is explicitly allowed.
 * Keys naming key material or credentials are always masked, even if allowed.
 */
@Component
public class ActuatorSanitizer implements SanitizingFunction {
    private static final String[] REGEX_PARTS = {"*", "$", "^", "+"};
    private static final Set<String> ALWAYS_MASKED = Set.of("private-key", "secret", "password", "token");

    private final List<Pattern> allowed;
    private final List<Pattern> masked;

    public ActuatorSanitizer(ActuatorEnvProperties properties) {
        this.allowed = properties.getAllowedProperties().stream().map(ActuatorSanitizer::toPattern).toList();
        this.masked = ALWAYS_MASKED.stream().map(ActuatorSanitizer::toPattern).toList();
    }

    @Override
    public SanitizableData apply(SanitizableData data) {
        if (data.getValue() == null) {
            return data;
        }
        if (matchesAny(masked, data.getKey())) {
            return data.withSanitizedValue();
        }
        if (matchesAny(allowed, data.getKey())) {
            return data;
        }
        return data.withSanitizedValue();
    }

    private static boolean matchesAny(List<Pattern> patterns, String key) {
        return patterns.stream().anyMatch(pattern -> pattern.matcher(key).matches());
    }

    private static Pattern toPattern(String value) {
        for (String part : REGEX_PARTS) {
            if (value.contains(part)) {
                return Pattern.compile(value, Pattern.CASE_INSENSITIVE);
            }
        }
        return Pattern.compile(".*" + Pattern.quote(value) + "$", Pattern.CASE_INSENSITIVE);
    }
}
