package com.gateway.request;

import com.gateway.auth.AuthDispatcher;
import com.gateway.config.GatewayProperties;
import com.gateway.dto.request.CallRequest;
import com.gateway.exception.InvalidSpecificationException;
import com.gateway.exception.MissingRequiredParameterException;
import com.gateway.model.ApiDocument;
import com.gateway.model.Endpoint;
import com.gateway.model.Parameter;
import com.gateway.model.ParameterLocation;
import com.gateway.protocol.WireRequest;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedCaseInsensitiveMap;
import org.springframework.web.util.UriUtils;

/**
 * Builds the {@link WireRequest} for one endpoint call from the caller's parameters, headers
 * and body.
 * <p>
 * Every declared parameter is checked and coerced to its schema type first. Address
 * placeholders are then substituted (percent-encoded for REST), declared header and cookie
 * parameters are moved to their place and every remaining parameter becomes a query parameter
 * (REST) or a channel parameter (pub/sub). Authentication is applied last so nothing can
 * overwrite it.
 */
@Component
@Slf4j
public class RequestBuilder {

    private final AuthDispatcher authDispatcher;
    private final String userAgent;

    public RequestBuilder(AuthDispatcher authDispatcher, GatewayProperties properties) {
        this.authDispatcher = authDispatcher;
        this.userAgent = properties.getHttp().getUserAgent();
    }

    public WireRequest build(Endpoint endpoint, ApiDocument document, CallRequest call) {
        boolean rest = "http".equals(endpoint.getProtocol());
        Map<String, Object> remaining = new LinkedHashMap<>(call.params());
        Map<String, String> callerHeaders = new LinkedCaseInsensitiveMap<>();
        callerHeaders.putAll(call.headers());

        WireRequest request = new WireRequest();
        request.setProtocol(endpoint.getProtocol());
        request.setMethod(rest ? endpoint.getOperationKind().toUpperCase(Locale.ROOT) : endpoint.getOperationKind());
        request.getHeaders().putAll(callerHeaders);

        Map<String, Parameter> declared = new LinkedHashMap<>();
        for (Parameter parameter : endpoint.getParameters()) {
            declared.put(parameter.getName(), parameter);
            Object value = remaining.get(parameter.getName());
            if (value == null && parameter.getLocation() == ParameterLocation.HEADER) {
                value = removeIgnoringCase(remaining, parameter.getName());
                if (value == null) {
                    value = callerHeaders.get(parameter.getName());
                }
            }
            if (value == null) {
                if (parameter.isRequired()) {
                    throw new MissingRequiredParameterException(parameter.getName());
                }
                continue;
            }
            remaining.put(parameter.getName(), ValueCoercion.coerce(parameter.getName(), value, parameter.getSchema()));
        }

        String address = substitute(endpoint.getAddressPattern(), remaining, rest);
        request.setAddress(address);

        remaining.forEach((name, value) -> {
            Parameter parameter = declared.get(name);
            ParameterLocation location = parameter != null ? parameter.getLocation() : null;
            if (location == ParameterLocation.HEADER) {
                request.getHeaders().put(name, String.valueOf(value));
            } else if (location == ParameterLocation.COOKIE) {
                request.getCookies().put(name, String.valueOf(value));
            } else if (rest) {
                request.getQueryParams().put(name, value);
            } else {
                request.getChannelParams().put(name, value);
            }
        });

        request.setBody(call.body());
        if (rest) {
            if (document.getBaseAddress() == null || document.getBaseAddress().isBlank()) {
                throw new InvalidSpecificationException("servers", "document " + document.getId() + " declares no server to call");
            }
            request.setUrl(UrlJoiner.join(document.getBaseAddress(), address));
            request.getHeaders().putIfAbsent(HttpHeaders.USER_AGENT, userAgent);
            if (call.body() != null) {
                request.getHeaders().putIfAbsent(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
            }
        } else {
            request.setServerAddress(endpoint.getServerAddress());
            request.getHeaders().putIfAbsent(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        }

        authDispatcher.apply(request, document, call.userId());
        log.debug("Built request {}", request.redacted());
        return request;
    }

    /**
     * Header names are case-insensitive, so a header parameter may be passed under any casing.
     */
    private static Object removeIgnoringCase(Map<String, Object> params, String name) {
        for (String key : params.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return params.remove(key);
            }
        }
        return null;
    }

    /**
     * Replaces every {@code {name}} token and removes the consumed parameters.
     *
     * @throws MissingRequiredParameterException if a token has no value.
     */
    private static String substitute(String pattern, Map<String, Object> params, boolean encode) {
        Matcher matcher = AddressPattern.PLACEHOLDER.matcher(pattern);
        StringBuilder address = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            Object value = params.remove(name);
            if (value == null) {
                throw new MissingRequiredParameterException(name);
            }
            String text = String.valueOf(value);
            matcher.appendReplacement(address, Matcher.quoteReplacement(
                    encode ? UriUtils.encodePathSegment(text, StandardCharsets.UTF_8) : text));
        }
        matcher.appendTail(address);
        return address.toString();
    }
}
