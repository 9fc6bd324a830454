/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.utils;

import org.opensearch.pond.core.exception.UtilityException;
import org.opensearch.test.OpenSearchTestCase;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

public class TimeUtilsTests extends OpenSearchTestCase {

    private static final long APRIL_22_2015 = 1429673400000L;

    public void testToEpochMillisAcceptsZonedValues() {
        assertEquals(APRIL_22_2015, TimeUtils.toEpochMillis(APRIL_22_2015));
        assertEquals(APRIL_22_2015, TimeUtils.toEpochMillis(Instant.ofEpochMilli(APRIL_22_2015)));
        assertEquals(APRIL_22_2015, TimeUtils.toEpochMillis(ZonedDateTime.of(2015, 4, 22, 3, 30, 0, 0, ZoneOffset.UTC)));
        assertEquals(APRIL_22_2015, TimeUtils.toEpochMillis(OffsetDateTime.of(2015, 4, 22, 5, 30, 0, 0, ZoneOffset.ofHours(2))));
        assertEquals(APRIL_22_2015, TimeUtils.toEpochMillis(new Date(APRIL_22_2015)));
    }

    public void testToEpochMillisRejectsNaiveValues() {
        expectThrows(UtilityException.class, () -> TimeUtils.toEpochMillis(LocalDateTime.of(2015, 4, 22, 3, 30)));
        expectThrows(UtilityException.class, () -> TimeUtils.toEpochMillis(LocalDate.of(2015, 4, 22)));
        expectThrows(UtilityException.class, () -> TimeUtils.toEpochMillis("2015-04-22"));
        expectThrows(UtilityException.class, () -> TimeUtils.toEpochMillis(null));
    }

    public void testLocalizeAttachesZone() {
        ZonedDateTime localized = TimeUtils.localize(LocalDateTime.of(2015, 4, 22, 5, 30), ZoneId.of("Europe/Berlin"));
        assertEquals(APRIL_22_2015, localized.toInstant().toEpochMilli());
        expectThrows(UtilityException.class, () -> TimeUtils.localize(LocalDateTime.of(2015, 4, 22, 5, 30), null));
    }

    public void testFormatUtc() {
        assertEquals("2015-04-22T03:30:00.000Z", TimeUtils.formatUtc(APRIL_22_2015));
    }

    public void testPlusMonthsClampsDay() {
        long january31 = ZonedDateTime.of(2015, 1, 31, 0, 0, 0, 0, ZoneOffset.UTC).toInstant().toEpochMilli();
        long february28 = ZonedDateTime.of(2015, 2, 28, 0, 0, 0, 0, ZoneOffset.UTC).toInstant().toEpochMilli();
        assertEquals(february28, TimeUtils.plusMonths(january31, 1));
    }
}
