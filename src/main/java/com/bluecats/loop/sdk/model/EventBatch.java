package com.bluecats.loop.sdk.model;

import com.bluecats.loop.sdk.exception.InvalidArgumentException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Request body for {@code POST events}: the edge MAC plus the raw event payloads in order. */
@JsonPropertyOrder({"edgeMAC", "events"})
public class EventBatch {
    @JsonProperty("edgeMAC")
    private final String edgeMac;
    @JsonProperty("events")
    private final List<Object> events;

    private EventBatch(String edgeMac, List<Object> events) {
        this.edgeMac = edgeMac;
        this.events = events;
    }

    /**
     * Build the wire body for a submission.
     *
     * @param edgeMac    MAC address of the edge relay that generated the events
     * @param eventInfos events to send, possibly empty
     */
    public static EventBatch of(String edgeMac, List<EventInfo> eventInfos) {
        InvalidArgumentException.requireNonNull(edgeMac, "edgeMac");
        InvalidArgumentException.requireNonNull(eventInfos, "eventInfos");
        List<Object> payloads = new ArrayList<>(eventInfos.size());
        for (EventInfo info : eventInfos) {
            payloads.add(InvalidArgumentException.requireNonNull(info, "eventInfos[" + payloads.size() + "]")
                    .getEventData());
        }
        return new EventBatch(edgeMac, Collections.unmodifiableList(payloads));
    }

    public String getEdgeMac() { return edgeMac; }
    public List<Object> getEvents() { return events; }
}
