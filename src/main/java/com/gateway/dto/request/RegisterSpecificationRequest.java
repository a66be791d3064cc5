package com.gateway.dto.request;

/**
 * A record that encapsulates the data required to register a specification document.
 *
 * @param name        A user-defined name for the registered API.
 * @param source      The URL or local file path of the OpenAPI or AsyncAPI document.
 * @param familyHint  The specification family to use instead of detection, may be {@code null}.
 * @param baseAddress An address overriding the document's first server, may be {@code null}.
 */
public record RegisterSpecificationRequest(String name, String source, String familyHint, String baseAddress) {
}
