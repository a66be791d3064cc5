package com.gateway.resolver;

import com.gateway.config.GatewayProperties;
import com.gateway.exception.TransportConnectionException;
import com.gateway.exception.TransportTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

@Component
@Slf4j
public class WebClientDocumentFetcher implements DocumentFetcher {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientDocumentFetcher(WebClient webClient, GatewayProperties properties) {
        this.webClient = webClient;
        this.timeout = properties.getHttp().getTimeout();
    }

    @Override
    public String fetch(String url) {
        log.info("Fetching document from {}", url);
        try {
            String body = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return body == null ? "" : body;
        } catch (WebClientResponseException e) {
            throw new TransportConnectionException(TransportConnectionException.Reason.IO,
                    "Fetching " + url + " failed with status " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw new TransportConnectionException(TransportConnectionException.Reason.IO,
                    "Could not reach " + url + ": " + e.getMostSpecificCause().getMessage(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new TransportTimeoutException("Fetching " + url + " timed out after " + timeout.toMillis() + " ms", e);
            }
            throw e;
        }
    }
}
