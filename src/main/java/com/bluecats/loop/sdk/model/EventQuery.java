package com.bluecats.loop.sdk.model;

import com.bluecats.loop.sdk.exception.InvalidArgumentException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Filter and cursor parameters for a paginated event read.
 *
 * <p>{@code objectType} and {@code objectID} are required; everything else
 * is optional. A time window is only sent when both {@code startTime} and
 * {@code endTime} are set.
 */
public class EventQuery {
    public static final String ROUTE = "events";

    private final String objectType;
    private final String objectID;
    private String eventType;
    private String lastKeyID;
    private Instant lastKeyTimestamp;
    private Integer limit;
    private Instant startTime;
    private Instant endTime;

    public EventQuery(String objectType, String objectID) {
        this.objectType = InvalidArgumentException.requireNonNull(objectType, "objectType");
        this.objectID = InvalidArgumentException.requireNonNull(objectID, "objectID");
    }

    /** Copy of this query with the same filters and cursor. */
    public EventQuery copy() {
        return new EventQuery(objectType, objectID)
                .setEventType(eventType)
                .setLastKeyID(lastKeyID)
                .setLastKeyTimestamp(lastKeyTimestamp)
                .setLimit(limit)
                .setStartTime(startTime)
                .setEndTime(endTime);
    }

    public String getObjectType() { return objectType; }
    public String getObjectID() { return objectID; }
    public String getEventType() { return eventType; }
    public EventQuery setEventType(String v) { this.eventType = v; return this; }
    public String getLastKeyID() { return lastKeyID; }
    public EventQuery setLastKeyID(String v) { this.lastKeyID = v; return this; }
    public Instant getLastKeyTimestamp() { return lastKeyTimestamp; }
    public EventQuery setLastKeyTimestamp(Instant v) { this.lastKeyTimestamp = v; return this; }
    public Integer getLimit() { return limit; }
    public EventQuery setLimit(Integer v) { this.limit = v; return this; }
    public Instant getStartTime() { return startTime; }
    public EventQuery setStartTime(Instant v) { this.startTime = v; return this; }
    public Instant getEndTime() { return endTime; }
    public EventQuery setEndTime(Instant v) { this.endTime = v; return this; }

    /** Convert to query string for URL. Parameter order is fixed. */
    public String toQueryString() {
        StringBuilder sb = new StringBuilder();
        appendParam(sb, "objectType", objectType);
        appendParam(sb, "objectID", objectID);
        if (eventType != null && !eventType.isEmpty()) appendParam(sb, "eventType", eventType);
        if (lastKeyID != null && !lastKeyID.isEmpty()) appendParam(sb, "lastKeyID", lastKeyID);
        if (lastKeyTimestamp != null) appendParam(sb, "lastKeyTS", LoopTimestamps.format(lastKeyTimestamp));
        if (limit != null) appendParam(sb, "limit", String.valueOf(limit));
        // A half-open window is dropped entirely
        if (startTime != null && endTime != null) {
            appendParam(sb, "tsStart", LoopTimestamps.format(startTime));
            appendParam(sb, "tsEnd", LoopTimestamps.format(endTime));
        }
        return sb.toString();
    }

    /** Route plus query string, relative to the API base URL. */
    public String toRelativeUri() {
        return ROUTE + "?" + toQueryString();
    }

    private static void appendParam(StringBuilder sb, String key, String value) {
        if (sb.length() > 0) sb.append('&');
        sb.append(key).append('=').append(encode(value));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
