package com.bluecats.loop.sdk.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/** A Loop event as returned by the events endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoopEvent {
    private String id;
    private String objectType;
    @JsonProperty("objectID")
    private String objectID;
    private String eventType;
    @JsonProperty("edgeMAC")
    private String edgeMac;
    @JsonAlias("ts")
    private Instant timestamp;
    private Map<String, Object> data;

    public LoopEvent() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getObjectType() { return objectType; }
    public void setObjectType(String objectType) { this.objectType = objectType; }
    public String getObjectID() { return objectID; }
    public void setObjectID(String objectID) { this.objectID = objectID; }
    public String getEventType() { return eventType; }
    public void setEventType(String eventType) { this.eventType = eventType; }
    public String getEdgeMac() { return edgeMac; }
    public void setEdgeMac(String edgeMac) { this.edgeMac = edgeMac; }
    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
    public Map<String, Object> getData() { return data; }
    public void setData(Map<String, Object> data) { this.data = data; }
}
