package com.bluecats.loop.sdk;

import com.bluecats.loop.sdk.exception.*;
import com.bluecats.loop.sdk.model.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Java client for the Loop event-tracking API.
 *
 * <p>Call {@link #login(String, String)} once, then read events with
 * {@link #getPaginatedEvents(EventQuery)} and submit them with
 * {@link #postEvents(String, EventInfo...)}. Every call has an async
 * variant returning a {@link CompletableFuture}. Nothing is retried.
 *
 * <p>One client holds one session. Build a new client to log in as someone else.
 */
public class LoopClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LoopClient.class);

    static final String API_HEADER = "X-API-HEADER";
    static final String API_HEADER_VALUE = "1";
    static final String LOGIN_ROUTE = "login";

    private final URI baseUri;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final LoopSession session = new LoopSession();
    private final ResponseUnwrapper unwrapper = new ResponseUnwrapper();

    LoopClient(LoopClientBuilder b) {
        this.baseUri = parseBaseUri(b.url);
        this.timeout = InvalidArgumentException.requireNonNull(b.timeout, "timeout");
        this.objectMapper = b.objectMapper != null ? b.objectMapper : createDefaultMapper();
        this.executor = InvalidArgumentException.requireNonNull(b.executor, "executor");
        this.httpClient = b.httpClient != null ? b.httpClient : HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        logger.info("Loop client created for {} (timeout: {})", baseUri, timeout);
    }

    private static URI parseBaseUri(String url) {
        InvalidArgumentException.requireNonNull(url, "url");
        URI uri;
        try {
            uri = URI.create(url.endsWith("/") ? url : url + "/");
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("url", "Invalid base URL: " + url, e);
        }
        // "localhost:8080" parses as an opaque URI with scheme "localhost"
        if (!uri.isAbsolute() || uri.isOpaque() || uri.getHost() == null) {
            throw new InvalidArgumentException("url", "Base URL must be absolute, e.g. https://host/path: " + url, null);
        }
        return uri;
    }

    static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    /** Create a new builder. */
    public static LoopClientBuilder builder() {
        return new LoopClientBuilder();
    }

    /**
     * Create a client from environment variables.
     * Reads {@code LOOP_API_URL}.
     */
    public static LoopClient fromEnv() {
        String url = System.getenv("LOOP_API_URL");
        return builder()
                .url(url != null ? url : LoopClientBuilder.DEFAULT_URL)
                .build();
    }

    /** Base URL all routes are resolved against. */
    public URI getBaseUri() {
        return baseUri;
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit close in Java 17
    }

    // ─── Session ───────────────────────────────────────────────

    /** True once a login has returned a non-empty token. */
    public boolean isAuthenticated() {
        return session.isAuthenticated();
    }

    /**
     * Authenticate with the Loop API. Required before any other call.
     *
     * @throws AuthenticationException if the server answered 2xx without an {@code auth} token
     * @throws RemoteRequestException  if the server answered with a failure status
     */
    public void login(String email, String password) {
        InvalidArgumentException.requireNonNull(email, "email");
        InvalidArgumentException.requireNonNull(password, "password");

        Map<String, String> credentials = new LinkedHashMap<>();
        credentials.put("email", email);
        credentials.put("password", password);

        HttpResponse<InputStream> response = send("POST", LOGIN_ROUTE, encode(credentials, "credentials"), false);
        String json = unwrapper.unwrap(response);

        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DecodingException("Failed to parse login response: " + e.getOriginalMessage(), e, response.statusCode());
        }
        JsonNode auth = node != null ? node.path("auth") : null;
        String token = auth != null && auth.isTextual() ? auth.asText() : null;
        if (token == null || token.isEmpty()) {
            logger.warn("Login to {} returned HTTP {} without an auth token", baseUri, response.statusCode());
            throw new AuthenticationException(response.statusCode());
        }
        session.setToken(token);
        logger.debug("Authenticated against {}", baseUri);
    }

    public CompletableFuture<Void> loginAsync(String email, String password) {
        return CompletableFuture.runAsync(() -> login(email, password), executor);
    }

    // ─── Events ────────────────────────────────────────────────

    /**
     * Read one page of events for a Loop object.
     * Use {@link PaginatedEvents#nextPage(EventQuery)} to build the query for the following page.
     */
    public PaginatedEvents getPaginatedEvents(EventQuery query) {
        InvalidArgumentException.requireNonNull(query, "query");
        session.ensureAuthenticated();

        HttpResponse<InputStream> response = send("GET", query.toRelativeUri(), null, true);
        String json = unwrapper.unwrap(response);
        PaginatedEvents page;
        try {
            page = objectMapper.readValue(json, PaginatedEvents.class);
        } catch (JsonProcessingException e) {
            throw new DecodingException("Failed to parse events page: " + e.getOriginalMessage(), e, response.statusCode());
        }
        // A literal "null" body decodes to no page at all
        if (page == null) {
            throw new DecodingException("Empty events page", null, response.statusCode());
        }
        return page;
    }

    public CompletableFuture<PaginatedEvents> getPaginatedEventsAsync(EventQuery query) {
        return CompletableFuture.supplyAsync(() -> getPaginatedEvents(query), executor);
    }

    /**
     * Post events generated by an edge relay.
     *
     * @param edgeMac    MAC address of the edge relay that generated the events
     * @param eventInfos the events to post
     * @return the raw response body
     */
    public String postEvents(String edgeMac, EventInfo... eventInfos) {
        InvalidArgumentException.requireNonNull(eventInfos, "eventInfos");
        return postEvents(edgeMac, Arrays.asList(eventInfos));
    }

    /** List variant of {@link #postEvents(String, EventInfo...)}. */
    public String postEvents(String edgeMac, List<EventInfo> eventInfos) {
        EventBatch batch = EventBatch.of(edgeMac, eventInfos);
        session.ensureAuthenticated();

        HttpResponse<InputStream> response = send("POST", EventQuery.ROUTE, encode(batch, "eventInfos"), true);
        return unwrapper.unwrap(response);
    }

    public CompletableFuture<String> postEventsAsync(String edgeMac, EventInfo... eventInfos) {
        return CompletableFuture.supplyAsync(() -> postEvents(edgeMac, eventInfos), executor);
    }

    public CompletableFuture<String> postEventsAsync(String edgeMac, List<EventInfo> eventInfos) {
        return CompletableFuture.supplyAsync(() -> postEvents(edgeMac, eventInfos), executor);
    }

    // ─── Internal ──────────────────────────────────────────────

    private String encode(Object body, String argument) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException(argument, "Failed to encode " + argument + ": " + e.getOriginalMessage(), e);
        }
    }

    private HttpResponse<InputStream> send(String method, String route, String json, boolean authenticated) {
        URI uri = baseUri.resolve(route);
        HttpRequest.Builder reqBuilder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .header(API_HEADER, API_HEADER_VALUE);

        if (authenticated) {
            reqBuilder.header("Authorization", "Bearer " + session.token());
        }

        if (json != null) {
            reqBuilder.header("Content-Type", "application/json");
            reqBuilder.method(method, HttpRequest.BodyPublishers.ofString(json));
        } else {
            reqBuilder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        logger.debug("{} {}", method, uri);
        try {
            return httpClient.send(reqBuilder.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new TransportException("Failed to connect to Loop at " + baseUri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Request interrupted", e);
        }
    }
}
