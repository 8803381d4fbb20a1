package com.automagik.telemetry.transport.http;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.automagik.telemetry.transport.TransportException;
import com.github.tomakehurst.wiremock.WireMockServer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpPosterTest {

    private WireMockServer wm;
    private HttpPoster poster;

    @BeforeEach
    void start() {
        wm = new WireMockServer(options().dynamicPort());
        wm.start();
        poster = new HttpPoster(Duration.ofSeconds(2));
    }

    @AfterEach
    void stop() {
        poster.close();
        wm.stop();
    }

    @Test
    void posts_body_with_headers() throws Exception {
        wm.stubFor(post(urlEqualTo("/ingest")).willReturn(aResponse().withStatus(200)));
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);

        poster.post(
                HttpUrl.get(wm.baseUrl() + "/ingest"),
                new CompressedPayload(body, null),
                "application/json",
                Map.of("X-Test", "1"));

        wm.verify(postRequestedFor(urlEqualTo("/ingest"))
                .withHeader("Content-Type", containing("application/json"))
                .withHeader("X-Test", equalTo("1")));
    }

    @Test
    void marks_gzip_bodies() throws Exception {
        wm.stubFor(post(urlEqualTo("/ingest")).willReturn(aResponse().withStatus(204)));
        byte[] gz = Compressor.gzip("{}".getBytes(StandardCharsets.UTF_8));

        poster.post(HttpUrl.get(wm.baseUrl() + "/ingest"), new CompressedPayload(gz, "gzip"), "application/json", Map.of());

        wm.verify(postRequestedFor(urlEqualTo("/ingest")).withHeader("Content-Encoding", equalTo("gzip")));
    }

    @Test
    void non_success_status_becomes_transport_exception() {
        wm.stubFor(post(urlEqualTo("/ingest")).willReturn(aResponse().withStatus(503).withBody("overloaded")));

        assertThatThrownBy(() -> poster.post(
                        HttpUrl.get(wm.baseUrl() + "/ingest"),
                        new CompressedPayload(new byte[0], null),
                        "application/json",
                        Map.of()))
                .isInstanceOfSatisfying(TransportException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(503);
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getMessage()).contains("overloaded");
                });
    }
}
