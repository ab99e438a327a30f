package com.bluecats.loop.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Builder for {@link LoopClient}.
 *
 * <pre>{@code
 * LoopClient client = LoopClient.builder()
 *     .url("https://api.bluecats.com/loop/")
 *     .timeout(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public class LoopClientBuilder {
    static final String DEFAULT_URL = "http://localhost:8080/";

    String url = DEFAULT_URL;
    Duration timeout = Duration.ofSeconds(30);
    HttpClient httpClient;
    ObjectMapper objectMapper;
    Executor executor = ForkJoinPool.commonPool();

    LoopClientBuilder() {}

    /** Set the Loop API base URL. Routes are resolved relative to it. */
    public LoopClientBuilder url(String url) {
        this.url = url;
        return this;
    }

    /** Set the per-request timeout. Also used as connect timeout for the default HttpClient. */
    public LoopClientBuilder timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    /** Override the default HttpClient. */
    public LoopClientBuilder httpClient(HttpClient httpClient) {
        this.httpClient = httpClient;
        return this;
    }

    /** Override the default Jackson ObjectMapper. */
    public LoopClientBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    /** Executor for the {@code ...Async} methods. Defaults to the common pool. */
    public LoopClientBuilder executor(Executor executor) {
        this.executor = executor;
        return this;
    }

    /** Build the client. */
    public LoopClient build() {
        return new LoopClient(this);
    }
}
