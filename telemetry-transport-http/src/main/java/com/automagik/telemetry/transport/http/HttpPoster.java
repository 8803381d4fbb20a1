package com.automagik.telemetry.transport.http;

import com.automagik.telemetry.transport.TransportException;
import java.io.IOException;
import java.net.Inet4Address;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import okhttp3.Dns;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OkHttp-based POST with a per-call deadline. Non-2xx answers become {@link TransportException}s. */
public class HttpPoster {
    private static final Logger log = LoggerFactory.getLogger(HttpPoster.class);
    private static final Dns PREFER_IPV4_DNS = hostname -> {
        var addresses = new ArrayList<>(Dns.SYSTEM.lookup(hostname));
        addresses.sort((a, b) -> {
            boolean aV4 = a instanceof Inet4Address;
            boolean bV4 = b instanceof Inet4Address;
            if (aV4 == bV4) return 0;
            return aV4 ? -1 : 1;
        });
        return addresses;
    };

    private final OkHttpClient client;

    public HttpPoster(Duration timeout) {
        this.client = new OkHttpClient.Builder()
                .dns(PREFER_IPV4_DNS)
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    public void post(HttpUrl url, CompressedPayload payload, String contentType, Map<String, String> headers)
            throws IOException {
        Request.Builder rb = new Request.Builder()
                .url(url)
                .post(RequestBody.create(payload.body(), MediaType.parse(contentType)));
        if (payload.isCompressed()) rb.header("Content-Encoding", payload.contentEncoding());
        headers.forEach(rb::header);
        Request req = rb.build();

        try (Response r = client.newCall(req).execute()) {
            String responseBody = r.body() != null ? r.body().string() : "";
            if (!r.isSuccessful()) {
                throw TransportException.forStatus(r.code(), abbreviate(responseBody));
            }
            if (log.isDebugEnabled()) {
                log.debug(
                        "Telemetry request {} {} succeeded with status {} ({} bytes{})",
                        req.method(),
                        url.redact(),
                        r.code(),
                        payload.body().length,
                        payload.isCompressed() ? ", " + payload.contentEncoding() : "");
            }
        }
    }

    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
