package com.bluecats.loop.sdk.model;

import com.bluecats.loop.sdk.exception.InvalidArgumentException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBatchTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testPayloadsKeepOrder() throws Exception {
        EventInfo e1 = EventInfo.of(Map.of("type", "enter", "rssi", -60));
        EventInfo e2 = EventInfo.of(Map.of("type", "exit"));

        JsonNode json = mapper.valueToTree(EventBatch.of("AA:BB:CC:DD:EE:FF", List.of(e1, e2)));

        assertEquals("AA:BB:CC:DD:EE:FF", json.get("edgeMAC").asText());
        assertEquals(2, json.get("events").size());
        assertEquals("enter", json.get("events").get(0).get("type").asText());
        assertEquals(-60, json.get("events").get(0).get("rssi").asInt());
        assertEquals("exit", json.get("events").get(1).get("type").asText());
        assertEquals(2, json.size());
    }

    @Test
    void testEmptyBatch() throws Exception {
        String json = mapper.writeValueAsString(EventBatch.of("AA:BB:CC:DD:EE:FF", List.of()));
        assertEquals("{\"edgeMAC\":\"AA:BB:CC:DD:EE:FF\",\"events\":[]}", json);
    }

    @Test
    void testDuplicatesAreKept() {
        EventInfo same = EventInfo.of("ping");
        EventBatch batch = EventBatch.of("mac", List.of(same, same, same));
        assertEquals(List.of("ping", "ping", "ping"), batch.getEvents());
    }

    @Test
    void testPayloadIsForwardedVerbatim() throws Exception {
        JsonNode payload = mapper.readTree("{\"nested\":{\"a\":[1,2,3]},\"z\":null}");
        JsonNode json = mapper.valueToTree(EventBatch.of("mac", List.of(EventInfo.of(payload))));
        assertEquals(payload, json.get("events").get(0));
    }

    @Test
    void testLargeBatchKeepsOrder() {
        List<EventInfo> infos = new ArrayList<>();
        for (int i = 0; i < 500; i++) infos.add(EventInfo.of(i));
        List<Object> events = EventBatch.of("mac", infos).getEvents();
        for (int i = 0; i < 500; i++) assertEquals(i, events.get(i));
    }

    @Test
    void testNullArguments() {
        assertThrows(InvalidArgumentException.class, () -> EventBatch.of(null, List.of()));
        assertThrows(InvalidArgumentException.class, () -> EventBatch.of("mac", null));
        assertThrows(InvalidArgumentException.class, () -> EventBatch.of("mac", Arrays.asList(EventInfo.of(1), null)));
        assertThrows(InvalidArgumentException.class, () -> EventInfo.of(null));
    }
}
