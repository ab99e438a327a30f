package com.bluecats.loop.sdk.model;

import com.bluecats.loop.sdk.exception.InvalidArgumentException;

/**
 * A single outbound event. The payload is sent as-is: any value the
 * client's {@code ObjectMapper} can serialize ({@code Map}, {@code JsonNode}, a POJO).
 */
public class EventInfo {
    private final Object eventData;

    public EventInfo(Object eventData) {
        this.eventData = InvalidArgumentException.requireNonNull(eventData, "eventData");
    }

    public static EventInfo of(Object eventData) {
        return new EventInfo(eventData);
    }

    public Object getEventData() { return eventData; }
}
