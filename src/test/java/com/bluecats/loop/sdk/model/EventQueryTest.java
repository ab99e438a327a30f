package com.bluecats.loop.sdk.model;

import com.bluecats.loop.sdk.exception.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class EventQueryTest {

    private static final Instant START = Instant.parse("2024-03-01T12:30:05.250Z");
    private static final Instant END = Instant.parse("2024-03-02T00:00:00Z");

    @Test
    void testRequiredParamsOnly() {
        EventQuery query = new EventQuery("loc", "42");
        assertEquals("events?objectType=loc&objectID=42", query.toRelativeUri());
        assertEquals("objectType=loc&objectID=42", query.toQueryString());
    }

    @Test
    void testAllParamsInOrder() {
        EventQuery query = new EventQuery("loc", "42")
                .setEventType("enter")
                .setLastKeyID("k9")
                .setLastKeyTimestamp(START)
                .setLimit(50)
                .setStartTime(START)
                .setEndTime(END);

        assertEquals("objectType=loc&objectID=42&eventType=enter&lastKeyID=k9"
                        + "&lastKeyTS=2024-03-01T12%3A30%3A05.250Z&limit=50"
                        + "&tsStart=2024-03-01T12%3A30%3A05.250Z&tsEnd=2024-03-02T00%3A00%3A00.000Z",
                query.toQueryString());
    }

    @Test
    void testStartTimeWithoutEndTimeIsDropped() {
        String qs = new EventQuery("loc", "42").setStartTime(START).toQueryString();
        assertFalse(qs.contains("tsStart"));
        assertFalse(qs.contains("tsEnd"));
    }

    @Test
    void testEndTimeWithoutStartTimeIsDropped() {
        String qs = new EventQuery("loc", "42").setEndTime(END).toQueryString();
        assertFalse(qs.contains("tsStart"));
        assertFalse(qs.contains("tsEnd"));
    }

    @Test
    void testEmptyStringsAreSkipped() {
        EventQuery query = new EventQuery("loc", "42").setEventType("").setLastKeyID("");
        assertEquals("objectType=loc&objectID=42", query.toQueryString());
    }

    @Test
    void testValuesAreEscaped() {
        EventQuery query = new EventQuery("loc type", "a&b=c").setEventType("ü");
        assertEquals("objectType=loc%20type&objectID=a%26b%3Dc&eventType=%C3%BC", query.toQueryString());
    }

    @Test
    void testTimestampsAreRenderedInUtc() {
        Instant offset = java.time.OffsetDateTime.parse("2024-03-01T14:30:05.250+02:00").toInstant();
        String qs = new EventQuery("loc", "42").setLastKeyTimestamp(offset).toQueryString();
        assertTrue(qs.endsWith("lastKeyTS=2024-03-01T12%3A30%3A05.250Z"));
    }

    @Test
    void testRequiredParamsMustNotBeNull() {
        InvalidArgumentException e = assertThrows(InvalidArgumentException.class, () -> new EventQuery(null, "42"));
        assertEquals("objectType", e.getArgument());
        assertThrows(InvalidArgumentException.class, () -> new EventQuery("loc", null));
    }

    @Test
    void testCopyIsIndependent() {
        EventQuery original = new EventQuery("loc", "42").setLimit(10);
        EventQuery copy = original.copy().setLimit(20);
        assertEquals(10, original.getLimit());
        assertEquals(20, copy.getLimit());
        assertEquals(original.getObjectID(), copy.getObjectID());
    }
}
