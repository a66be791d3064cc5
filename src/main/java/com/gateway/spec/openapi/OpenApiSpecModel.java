package com.gateway.spec.openapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateway.exception.InvalidSpecificationException;
import com.gateway.model.ServerInfo;
import com.gateway.spec.DocumentValidation;
import com.gateway.spec.SpecModel;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import io.swagger.v3.parser.util.OpenAPIDeserializer;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * An OpenAPI 3.x document, kept both as the resolved tree and as swagger-parser's
 * {@link OpenAPI} model.
 */
@Slf4j
public class OpenApiSpecModel implements SpecModel {

    public static final String FAMILY = "rest";

    private final JsonNode document;
    private final OpenAPI openAPI;

    private OpenApiSpecModel(JsonNode document, OpenAPI openAPI) {
        this.document = document;
        this.openAPI = openAPI;
    }

    /**
     * Validates the resolved document and deserializes it. References are expected to be
     * expanded already, so the deserializer never has to follow one.
     */
    public static OpenApiSpecModel from(JsonNode resolvedDocument) {
        DocumentValidation.requireVersionMarker(resolvedDocument, "openapi", "3.");
        DocumentValidation.requireTitle(resolvedDocument);
        DocumentValidation.requireObject(resolvedDocument, "paths");

        SwaggerParseResult result = new OpenAPIDeserializer().deserialize(resolvedDocument.deepCopy());
        if (result.getOpenAPI() == null) {
            throw new InvalidSpecificationException("document", String.join("; ", result.getMessages()));
        }
        if (result.getMessages() != null && !result.getMessages().isEmpty()) {
            log.debug("OpenAPI deserializer reported: {}", result.getMessages());
        }
        return new OpenApiSpecModel(resolvedDocument, result.getOpenAPI());
    }

    public OpenAPI getOpenAPI() {
        return openAPI;
    }

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    public JsonNode document() {
        return document;
    }

    @Override
    public String title() {
        return document.path("info").path("title").asText();
    }

    @Override
    public String version() {
        JsonNode version = document.path("info").path("version");
        return version.isMissingNode() ? null : version.asText();
    }

    /**
     * The servers as written in the document. Unlike the deserialized model, no default
     * {@code /} server is invented when the document declares none.
     */
    @Override
    public List<ServerInfo> servers() {
        List<ServerInfo> servers = new ArrayList<>();
        document.path("servers").forEach(server -> {
            String url = server.path("url").asText(null);
            if (url != null) {
                servers.add(new ServerInfo(null, url, "http"));
            }
        });
        return servers;
    }
}
