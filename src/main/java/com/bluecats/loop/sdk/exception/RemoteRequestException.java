package com.bluecats.loop.sdk.exception;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Thrown when the server answered with a non-2xx status.
 *
 * <p>Carries the response diagnostics as fields; the message renders them
 * in a {@code [ Response ]} block for logs.
 */
public class RemoteRequestException extends LoopException {
    private final String method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final String body;

    public RemoteRequestException(String method, URI uri, int status,
                                  Map<String, List<String>> headers, String body) {
        super(formatMessage(method, uri, status, headers, body), status, "REMOTE_REQUEST_ERROR");
        this.method = method;
        this.uri = uri;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.body = body;
    }

    public String getMethod() { return method; }
    public URI getUri() { return uri; }
    public Map<String, List<String>> getHeaders() { return headers; }
    /** Response body, possibly truncated. */
    public String getBody() { return body; }

    private static String formatMessage(String method, URI uri, int status,
                                        Map<String, List<String>> headers, String body) {
        StringBuilder sb = new StringBuilder();
        sb.append("Request ").append(method).append(' ').append(uri)
          .append(" failed with HTTP ").append(status).append('\n');
        sb.append("[ Response ]\n");
        sb.append("StatusCode: ").append(status).append('\n');
        if (headers != null) {
            headers.forEach((name, values) ->
                    sb.append(name).append(": ").append(String.join(", ", values)).append('\n'));
        }
        if (body != null && !body.isEmpty()) {
            sb.append("Content: ").append(body).append('\n');
        }
        return sb.toString();
    }
}
