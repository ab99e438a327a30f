package com.bluecats.loop.sdk.model;

import com.bluecats.loop.sdk.exception.InvalidArgumentException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** One page of events plus the cursor for the next page. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaginatedEvents {
    private List<LoopEvent> events = List.of();
    private ContinuationKey lastKey;

    public PaginatedEvents() {}

    public List<LoopEvent> getEvents() { return events; }
    public void setEvents(List<LoopEvent> events) { this.events = events != null ? events : List.of(); }
    /** Null on the last page. */
    public ContinuationKey getLastKey() { return lastKey; }
    public void setLastKey(ContinuationKey lastKey) { this.lastKey = lastKey; }

    public boolean hasMore() {
        return lastKey != null && lastKey.getId() != null && !lastKey.getId().isEmpty();
    }

    /**
     * Query for the page after this one: a copy of {@code query} with its
     * cursor moved to this page's continuation key.
     *
     * @throws IllegalStateException if this is the last page
     */
    public EventQuery nextPage(EventQuery query) {
        if (!hasMore()) throw new IllegalStateException("No further pages");
        return InvalidArgumentException.requireNonNull(query, "query").copy()
                .setLastKeyID(lastKey.getId())
                .setLastKeyTimestamp(lastKey.getTimestamp());
    }
}
