package com.neowatch.feed.client;

import com.neowatch.common.exception.NeoFeedException;
import com.neowatch.common.exception.UpstreamRateLimitedException;
import com.neowatch.common.exception.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.TimeoutException;

/**
 * Thin client for the upstream NEO feed endpoint.
 *
 * <p>Issues exactly one {@code GET /feed} per subscription and classifies the outcome:
 * <ul>
 *   <li>200 → raw JSON body</li>
 *   <li>429 → {@link UpstreamRateLimitedException}</li>
 *   <li>any other status, network error or timeout → {@link UpstreamUnavailableException}</li>
 * </ul>
 * The timeout cancels the in-flight request.
 */
public class NeoFeedWebClient {

    private static final Logger log = LoggerFactory.getLogger(NeoFeedWebClient.class);

    public static final String SOURCE = "NeoWs";

    private final WebClient webClient;
    private final String apiKey;
    private final Duration timeout;

    public NeoFeedWebClient(WebClient neoFeedWebClient, String apiKey, Duration timeout) {
        this.webClient = neoFeedWebClient;
        this.apiKey    = apiKey;
        this.timeout   = timeout;
    }

    public Mono<String> fetchFeedJson(LocalDate startDate, LocalDate endDate) {
        return Mono.defer(() -> {
                log.info("Fetching NEO feed. provider={} start={} end={}", SOURCE, startDate, endDate);
                return webClient.get()
                    .uri(uriBuilder -> uriBuilder
                        .path("/feed")
                        .queryParam("start_date", startDate.toString())
                        .queryParam("end_date", endDate.toString())
                        .queryParam("api_key", apiKey)
                        .build())
                    .exchangeToMono(this::classify);
            })
            .timeout(timeout)
            .onErrorMap(e -> !(e instanceof NeoFeedException), this::toUnavailable)
            .doOnSuccess(body -> log.info("NEO feed fetched. provider={} start={} end={} bytes={}",
                                          SOURCE, startDate, endDate, body == null ? 0 : body.length()))
            .doOnError(e -> log.warn("NEO feed fetch failed. provider={} start={} end={} reason={}",
                                     SOURCE, startDate, endDate, e.getMessage()));
    }

    private Mono<String> classify(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.value() == 200) {
            return response.bodyToMono(String.class).defaultIfEmpty("");
        }
        if (status.value() == 429) {
            return response.releaseBody()
                .then(Mono.<String>error(new UpstreamRateLimitedException(SOURCE, "rate limit exceeded (429)")));
        }
        return response.releaseBody()
            .then(Mono.<String>error(new UpstreamUnavailableException(SOURCE,
                "unexpected status " + status.value(), status.value())));
    }

    private Throwable toUnavailable(Throwable e) {
        if (e instanceof TimeoutException) {
            return new UpstreamUnavailableException(SOURCE, "timed out after " + timeout.toSeconds() + "s", e);
        }
        return new UpstreamUnavailableException(SOURCE, "request failed: " + e.getMessage(), e);
    }
}
