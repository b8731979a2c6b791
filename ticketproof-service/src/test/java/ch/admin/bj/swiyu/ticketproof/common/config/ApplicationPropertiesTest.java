/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.common.config;

import ch.admin.bj.swiyu.ticketproof.common.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApplicationPropertiesTest {

    @Test
    void defaults() {
        var properties = new ApplicationProperties();

        assertEquals(60, properties.getProofValiditySeconds());
        assertEquals(300, properties.getNonceRetentionSeconds());
        assertEquals(5, properties.getClockSkewToleranceSeconds());
        assertTrue(properties.isRequireOnChainConfirmation());
        assertDoesNotThrow(properties::init);
    }

    @Test
    void init_retentionNotExceedingValidity_fails() {
        var properties = new ApplicationProperties();
        properties.setProofValiditySeconds(300);

        assertThrows(ConfigurationException.class, properties::init);
    }
}
