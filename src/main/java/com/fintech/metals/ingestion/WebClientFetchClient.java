package com.fintech.metals.ingestion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.concurrent.TimeoutException;

/**
 * {@link FetchClient} on Spring WebClient.
 *
 * JSON feeds are read as one body. Event-stream feeds are subscribed until the first
 * event carrying data arrives; taking that event cancels the subscription, which closes
 * the connection.
 */
@Component
public class WebClientFetchClient implements FetchClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientFetchClient.class);

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
        new ParameterizedTypeReference<>() {};

    // The supplier endpoint answers 404 with this text when nothing changed
    private static final String NO_UPDATES_MARKER = "No company updates available";

    private final WebClient webClient;

    public WebClientFetchClient(WebClient feedWebClient) {
        this.webClient = feedWebClient;
    }

    @Override
    public String fetch(FeedDefinition feed) throws FetchException {
        long start = System.nanoTime();
        try {
            String body = switch (feed.mode()) {
                case JSON -> readJson(feed);
                case EVENT_STREAM -> readFirstEvent(feed);
            };
            if (body == null || body.isBlank()) {
                throw FetchException.transport(feed.name(), "empty response", null);
            }
            if (log.isDebugEnabled()) {
                log.debug("Fetched feed {} in {}ms ({} chars)",
                         feed.name(), (System.nanoTime() - start) / 1_000_000, body.length());
            }
            return body;
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value() && e.getResponseBodyAsString().contains(NO_UPDATES_MARKER)) {
                log.debug("Feed {} reported no updates", feed.name());
                return "[]";
            }
            throw FetchException.transport(feed.name(), "HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw FetchException.timeout(feed.name(), cause);
            }
            if (cause instanceof WebClientResponseException responseException) {
                throw FetchException.transport(feed.name(), "HTTP " + responseException.getStatusCode().value(), cause);
            }
            throw FetchException.transport(feed.name(), String.valueOf(cause.getMessage()), cause);
        }
    }

    private String readJson(FeedDefinition feed) {
        return webClient.get()
            .uri(feed.url())
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(feed.timeout())
            .block();
    }

    private String readFirstEvent(FeedDefinition feed) {
        String data = webClient.get()
            .uri(feed.url())
            .accept(MediaType.TEXT_EVENT_STREAM)
            .retrieve()
            .bodyToFlux(SSE_TYPE)
            .mapNotNull(ServerSentEvent::data)
            .filter(payload -> !payload.isBlank())
            .next()
            .timeout(feed.timeout())
            .block();
        if (data == null) {
            throw new IllegalStateException("event stream closed without data");
        }
        return data;
    }
}
