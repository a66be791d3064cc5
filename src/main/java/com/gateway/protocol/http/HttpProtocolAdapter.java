package com.gateway.protocol.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.protocol.RequestResponseAdapter;
import com.gateway.protocol.TransportErrors;
import com.gateway.protocol.WireRequest;
import com.gateway.protocol.WireResponse;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Executes REST calls with the shared {@link WebClient}.
 * <p>
 * Every status the backend answers with is returned as a {@link WireResponse}; only transport
 * failures raise. JSON bodies (any {@code application/json} or {@code +json} media type) are
 * decoded into a tree, other bodies are returned as text.
 */
@Slf4j
public class HttpProtocolAdapter implements RequestResponseAdapter {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public HttpProtocolAdapter(WebClient webClient, ObjectMapper objectMapper, Duration timeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public String protocol() {
        return "http";
    }

    @Override
    public WireResponse execute(WireRequest request) {
        URI uri = toUri(request);
        HttpMethod method = HttpMethod.valueOf(request.getMethod().toUpperCase());
        log.debug("Executing {} request: {}", method, request.redacted());

        WebClient.RequestBodySpec spec = webClient.method(method)
                .uri(uri)
                .headers(headers -> request.getHeaders().forEach(headers::set))
                .cookies(cookies -> request.getCookies().forEach(cookies::add));
        WebClient.RequestHeadersSpec<?> exchange = request.getBody() != null ? spec.bodyValue(request.getBody()) : spec;

        try {
            ResponseEntity<byte[]> entity = exchange
                    .exchangeToMono(response -> response.toEntity(byte[].class))
                    .timeout(timeout)
                    .block();
            if (entity == null) {
                return new WireResponse(null, Map.of(), null);
            }
            log.debug("{} {} answered with status {}", method, request.getUrl(), entity.getStatusCode().value());
            return toWireResponse(entity);
        } catch (RuntimeException e) {
            throw TransportErrors.translate(method + " " + request.getUrl(), e);
        }
    }

    private URI toUri(WireRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(request.getUrl());
        request.getQueryParams().forEach((name, value) -> {
            if (value instanceof Collection<?> values) {
                values.forEach(item -> builder.queryParam(encode(name), encode(String.valueOf(item))));
            } else {
                builder.queryParam(encode(name), encode(String.valueOf(value)));
            }
        });
        return builder.build(true).toUri();
    }

    private static String encode(String value) {
        return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8);
    }

    private WireResponse toWireResponse(ResponseEntity<byte[]> entity) {
        Map<String, String> headers = new LinkedHashMap<>();
        entity.getHeaders().forEach((name, values) -> {
            if (!values.isEmpty()) {
                headers.put(name, values.get(0));
            }
        });
        return new WireResponse(entity.getStatusCode().value(), headers, decodeBody(entity));
    }

    private Object decodeBody(ResponseEntity<byte[]> entity) {
        byte[] body = entity.getBody();
        if (body == null || body.length == 0) {
            return null;
        }
        MediaType contentType = entity.getHeaders().getContentType();
        if (contentType != null && isJson(contentType)) {
            try {
                return objectMapper.readTree(body);
            } catch (IOException e) {
                log.warn("Response declared {} but is not valid JSON, returning raw text", contentType);
            }
        }
        return new String(body, contentType != null && contentType.getCharset() != null
                ? contentType.getCharset() : StandardCharsets.UTF_8);
    }

    private static boolean isJson(MediaType contentType) {
        return MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                || (contentType.getSubtype() != null && contentType.getSubtype().endsWith("+json"));
    }

    @Override
    public void close() {
        // the WebClient is a shared bean; its connection pool is released by the context
    }
}
