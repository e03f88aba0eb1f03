package com.neowatch.feed.config;

import com.neowatch.feed.client.NeoFeedWebClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${neo.api.base-url:https://api.nasa.gov/neo/rest/v1}")
    private String baseUrl;

    @Value("${neo.api.key:DEMO_KEY}")
    private String apiKey;

    @Value("${neo.api.timeout-seconds:12}")
    private int timeoutSeconds;

    @Value("${neo.api.connect-timeout-millis:10000}")
    private int connectTimeoutMillis;

    @Bean
    public WebClient neoFeedWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public NeoFeedWebClient neoFeedClient(WebClient neoFeedWebClient) {
        return new NeoFeedWebClient(neoFeedWebClient, apiKey, Duration.ofSeconds(timeoutSeconds));
    }

    static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitize(clientRequest.url().toString()));
            return Mono.just(clientRequest);
        });
    }

    static String sanitize(String uri) {
        return uri.replaceAll("api_key=[^&]+", "api_key=***");
    }
}
