package com.trafficguardian.detector.traffic;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FieldValuesTest {

    @Test
    void shouldTreatAbsentMarkersAsMissing() {
        assertNull(FieldValues.toText("-"));
        assertNull(FieldValues.toText("(empty)"));
        assertNull(FieldValues.toText("  "));
        assertNull(FieldValues.toLong("NaN"));
        assertEquals("http", FieldValues.toText(" http "));
    }

    @Test
    void shouldParseNumbersLeniently() {
        assertEquals(42L, FieldValues.toLong("42"));
        assertEquals(3L, FieldValues.toLong("2.6"));
        assertEquals(12, FieldValues.toInteger(12L));
        assertNull(FieldValues.toInteger("not a number"));
        assertNull(FieldValues.toInteger("99999999999"));
        assertEquals(0.25, FieldValues.toDouble("0.25"));
    }

    @Test
    void shouldParseTimestampFormats() {
        Instant expected = Instant.parse("2024-03-04T10:15:30Z");

        assertEquals(expected, FieldValues.toInstant("2024-03-04T10:15:30Z"));
        assertEquals(expected, FieldValues.toInstant("2024-03-04T10:15:30"));
        assertEquals(expected, FieldValues.toInstant("2024-03-04 10:15:30"));
        assertEquals(expected, FieldValues.toInstant(expected.getEpochSecond()));
        assertEquals(expected, FieldValues.toInstant(expected.toEpochMilli()));
        assertEquals(Instant.parse("2024-03-04T00:00:00Z"), FieldValues.toInstant("2024-03-04"));
        assertNull(FieldValues.toInstant("yesterday"));
    }
}
