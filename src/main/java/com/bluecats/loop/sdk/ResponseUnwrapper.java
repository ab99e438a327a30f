package com.bluecats.loop.sdk;

import com.bluecats.loop.sdk.exception.RemoteRequestException;
import com.bluecats.loop.sdk.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * Turns a received HTTP response into its body text or a
 * {@link RemoteRequestException}. The body stream is closed on every path.
 */
class ResponseUnwrapper {

    private static final Logger logger = LoggerFactory.getLogger(ResponseUnwrapper.class);

    static final int MAX_DIAGNOSTIC_BODY = 2048;

    String unwrap(HttpResponse<InputStream> response) {
        int status = response.statusCode();
        String method = response.request().method();
        try (InputStream in = response.body()) {
            if (status >= 200 && status < 300) {
                String body = readBody(in);
                logger.debug("{} {} -> {}", method, response.uri(), status);
                return body;
            }
            // The status line arrived, so a failed body read is still a remote failure
            String body;
            try {
                body = readBody(in);
            } catch (IOException e) {
                logger.debug("Could not read error body from {}: {}", response.uri(), e.getMessage());
                body = "";
            }
            logger.warn("{} {} failed with HTTP {}", method, response.uri(), status);
            throw new RemoteRequestException(method, response.uri(), status, response.headers().map(), truncate(body));
        } catch (IOException e) {
            throw new TransportException("Failed to read response from " + response.uri() + ": " + e.getMessage(), e);
        }
    }

    private static String readBody(InputStream in) throws IOException {
        return in != null ? new String(in.readAllBytes(), StandardCharsets.UTF_8) : "";
    }

    private static String truncate(String body) {
        if (body.length() <= MAX_DIAGNOSTIC_BODY) return body;
        return body.substring(0, MAX_DIAGNOSTIC_BODY) + "...";
    }
}
