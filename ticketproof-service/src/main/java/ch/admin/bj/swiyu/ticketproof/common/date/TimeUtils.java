/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.common.date;

import lombok.experimental.UtilityClass;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import static java.util.Objects.isNull;

@UtilityClass
public class TimeUtils {

    private static final DateTimeFormatter ISO_OFFSET_DATE_TIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX").withZone(ZoneOffset.UTC);

    /**
     * Current UNIX timestamp in whole seconds, truncated towards the past.
     */
    public static long nowEpochSeconds(Clock clock) {
        return clock.instant().getEpochSecond();
    }

    public static String epochSecondsToISO8601(Long epochSeconds) {
        if (isNull(epochSeconds)) {
            return null;
        }
        return ISO_OFFSET_DATE_TIME_FORMATTER.format(Instant.ofEpochSecond(epochSeconds).atOffset(ZoneOffset.UTC));
    }
}
