package com.bluecats.loop.sdk.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/** Key of the last item on a page; feed it back to read the next page. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContinuationKey {
    private String id;
    @JsonAlias("ts")
    private Instant timestamp;

    public ContinuationKey() {}

    public ContinuationKey(String id, Instant timestamp) {
        this.id = id;
        this.timestamp = timestamp;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
