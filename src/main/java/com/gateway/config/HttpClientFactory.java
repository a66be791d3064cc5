package com.gateway.config;

import io.netty.channel.ChannelOption;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * A Spring configuration class responsible for creating and configuring HTTP client beans.
 * This factory provides a centralized place to define shared client configurations such as
 * timeouts and buffer limits.
 */
@Configuration
public class HttpClientFactory {

    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    /**
     * Creates the shared WebClient used for backend calls, external document fetches and
     * OAuth2 token exchanges.
     * <p>
     * Connect and response timeouts are enforced by Reactor Netty. Requests are never retried:
     * a failed call surfaces to the caller as-is.
     *
     * @param properties The gateway settings holding the HTTP timeouts.
     * @return A fully configured {@link WebClient} instance ready for use in the application.
     */
    @Bean
    public WebClient webClient(GatewayProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getHttp().getConnectTimeout().toMillis())
                .responseTimeout(properties.getHttp().getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                        .build())
                .build();
    }

    /**
     * The clock every expiry decision is made against.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
