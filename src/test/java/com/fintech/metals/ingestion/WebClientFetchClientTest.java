package com.fintech.metals.ingestion;

import com.fintech.metals.domain.SeriesFamily;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WebClientFetchClient Tests")
class WebClientFetchClientTest {

    private MockWebServer server;
    private WebClientFetchClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new WebClientFetchClient(WebClient.builder().build());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private FeedDefinition feed(FeedMode mode, Duration timeout) {
        return new FeedDefinition("test-feed", server.url("/prices").toString(), mode,
            SeriesFamily.SPOT, "spot-aluminium", timeout, List.of());
    }

    @Test
    @DisplayName("JSON feed returns the response body")
    void readsJsonBody() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"spot_price\": \"240.50\"}"));

        String body = client.fetch(feed(FeedMode.JSON, Duration.ofSeconds(2)));

        assertThat(body).isEqualTo("{\"spot_price\": \"240.50\"}");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/prices");
    }

    @Test
    @DisplayName("Event stream returns the first event carrying data")
    void readsFirstEvent() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody(": keep-alive\n\n"
                + "data: {\"success\": true, \"data\": {\"Value\": \"2510.5\"}}\n\n"
                + "data: {\"success\": true, \"data\": {\"Value\": \"9999\"}}\n\n"));

        String body = client.fetch(feed(FeedMode.EVENT_STREAM, Duration.ofSeconds(2)));

        assertThat(body).contains("2510.5").doesNotContain("9999");
    }

    @Test
    @DisplayName("Slow feed fails with a TIMEOUT fetch error")
    void slowFeedTimesOut() {
        server.enqueue(new MockResponse()
            .setHeadersDelay(2, TimeUnit.SECONDS)
            .setBody("{}"));

        assertThatThrownBy(() -> client.fetch(feed(FeedMode.JSON, Duration.ofMillis(200))))
            .isInstanceOf(FetchException.class)
            .satisfies(e -> assertThat(((FetchException) e).getKind()).isEqualTo(FetchException.Kind.TIMEOUT));
    }

    @Test
    @DisplayName("Server error fails with a TRANSPORT fetch error")
    void serverErrorIsTransport() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));

        assertThatThrownBy(() -> client.fetch(feed(FeedMode.JSON, Duration.ofSeconds(2))))
            .isInstanceOf(FetchException.class)
            .hasMessageContaining("HTTP 500")
            .satisfies(e -> assertThat(((FetchException) e).getKind()).isEqualTo(FetchException.Kind.TRANSPORT));
    }

    @Test
    @DisplayName("Supplier 'no updates' 404 is read as an empty list")
    void noUpdatesIsEmptyList() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(404)
            .setBody("{\"detail\": \"No company updates available\"}"));

        assertThat(client.fetch(feed(FeedMode.JSON, Duration.ofSeconds(2)))).isEqualTo("[]");
    }

    @Test
    @DisplayName("Empty body is a TRANSPORT fetch error")
    void emptyBodyIsTransport() {
        server.enqueue(new MockResponse().setResponseCode(200));

        assertThatThrownBy(() -> client.fetch(feed(FeedMode.JSON, Duration.ofSeconds(2))))
            .isInstanceOf(FetchException.class)
            .satisfies(e -> assertThat(((FetchException) e).getKind()).isEqualTo(FetchException.Kind.TRANSPORT));
    }
}
