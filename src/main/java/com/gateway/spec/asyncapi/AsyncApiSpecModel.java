package com.gateway.spec.asyncapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateway.model.ServerInfo;
import com.gateway.spec.DocumentValidation;
import com.gateway.spec.SpecModel;
import java.util.ArrayList;
import java.util.List;

/**
 * An AsyncAPI 2.x document. The tree is navigated directly; there is no typed model for it.
 */
public class AsyncApiSpecModel implements SpecModel {

    public static final String FAMILY = "pubsub";

    private final JsonNode document;

    private AsyncApiSpecModel(JsonNode document) {
        this.document = document;
    }

    public static AsyncApiSpecModel from(JsonNode resolvedDocument) {
        DocumentValidation.requireVersionMarker(resolvedDocument, "asyncapi", "2.");
        DocumentValidation.requireTitle(resolvedDocument);
        DocumentValidation.requireObject(resolvedDocument, "channels");
        return new AsyncApiSpecModel(resolvedDocument);
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
     * AsyncAPI servers are keyed by name; their protocol is normalized the same way channel
     * bindings are.
     */
    @Override
    public List<ServerInfo> servers() {
        List<ServerInfo> servers = new ArrayList<>();
        document.path("servers").properties().forEach(entry -> {
            JsonNode server = entry.getValue();
            String url = server.path("url").asText(null);
            if (url != null) {
                servers.add(new ServerInfo(entry.getKey(), url, ProtocolNames.normalize(server.path("protocol").asText(""))));
            }
        });
        return servers;
    }
}
