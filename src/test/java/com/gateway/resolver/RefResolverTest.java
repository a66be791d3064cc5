package com.gateway.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateway.exception.ErrorKind;
import com.gateway.exception.GatewayException;
import com.gateway.exception.MalformedReferenceException;
import com.gateway.exception.TransportConnectionException;
import com.gateway.exception.UnsupportedReferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RefResolverTest {

    @Mock
    private DocumentFetcher fetcher;

    private final DocumentReader reader = new DocumentReader();
    private RefResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new RefResolver(fetcher, reader);
    }

    @Test
    void resolve_expandsInternalReferences() {
        JsonNode document = reader.read("""
                {"a": {"$ref": "#/defs/x"}, "defs": {"x": {"type": "string"}}}
                """);

        JsonNode resolved = resolver.resolve(document);

        assertThat(resolved.path("a").path("type").asText()).isEqualTo("string");
        assertThat(resolved.path("a").has("$ref")).isFalse();
    }

    @Test
    void resolve_doesNotModifyTheInput() {
        JsonNode document = reader.read("""
                {"a": {"$ref": "#/defs/x"}, "defs": {"x": {"type": "string"}}}
                """);

        resolver.resolve(document);

        assertThat(document.path("a").path("$ref").asText()).isEqualTo("#/defs/x");
    }

    @Test
    void resolve_followsChainedReferences() {
        JsonNode document = reader.read("""
                {"a": {"$ref": "#/defs/b"}, "defs": {"b": {"$ref": "#/defs/c"}, "c": {"type": "integer"}}}
                """);

        JsonNode resolved = resolver.resolve(document);

        assertThat(resolved.path("a").path("type").asText()).isEqualTo("integer");
    }

    @Test
    void resolve_replacesCycleWithCircularMarker() {
        JsonNode document = reader.read("""
                {"node": {"$ref": "#/defs/Node"},
                 "defs": {"Node": {"type": "object", "properties": {"next": {"$ref": "#/defs/Node"}}}}}
                """);

        JsonNode resolved = resolver.resolve(document);

        JsonNode next = resolved.path("node").path("properties").path("next");
        assertThat(RefResolver.isCircularMarker(next)).isTrue();
        assertThat(next.path("$ref").asText()).isEqualTo("#/defs/Node");
    }

    @Test
    void resolve_isIdempotent() {
        JsonNode document = reader.read("""
                {"node": {"$ref": "#/defs/Node"},
                 "defs": {"Node": {"properties": {"next": {"$ref": "#/defs/Node"}}}}}
                """);

        JsonNode once = resolver.resolve(document);
        JsonNode twice = resolver.resolve(once);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void resolve_decodesEscapedPointerSegments() {
        JsonNode document = reader.read("""
                {"target": {"$ref": "#/paths/~1pets~1{id}"}, "paths": {"/pets/{id}": {"get": {}}}}
                """);

        JsonNode resolved = resolver.resolve(document);

        assertThat(resolved.path("target").has("get")).isTrue();
    }

    @Test
    void resolve_missingTargetIsMalformed() {
        JsonNode document = reader.read("""
                {"a": {"$ref": "#/defs/missing"}, "defs": {}}
                """);

        assertThatThrownBy(() -> resolver.resolve(document))
                .isInstanceOf(MalformedReferenceException.class)
                .extracting(e -> ((GatewayException) e).getKind())
                .isEqualTo(ErrorKind.MALFORMED_REFERENCE);
    }

    @Test
    void resolve_relativeFileReferenceIsUnsupported() {
        JsonNode document = reader.read("""
                {"a": {"$ref": "./common.yaml#/Pet"}}
                """);

        assertThatThrownBy(() -> resolver.resolve(document))
                .isInstanceOf(UnsupportedReferenceException.class)
                .hasMessageContaining("./common.yaml#/Pet");
    }

    @Test
    void resolve_fetchesEachExternalDocumentOnce() {
        when(fetcher.fetch("https://schemas.example.com/common.json"))
                .thenReturn("{\"Pet\": {\"type\": \"object\", \"properties\": {\"owner\": {\"$ref\": \"#/Owner\"}}}, \"Owner\": {\"type\": \"string\"}}");
        JsonNode document = reader.read("""
                {"a": {"$ref": "https://schemas.example.com/common.json#/Pet"},
                 "b": {"$ref": "https://schemas.example.com/common.json#/Owner"}}
                """);

        JsonNode resolved = resolver.resolve(document);

        assertThat(resolved.path("a").path("properties").path("owner").path("type").asText()).isEqualTo("string");
        assertThat(resolved.path("b").path("type").asText()).isEqualTo("string");
        verify(fetcher, times(1)).fetch("https://schemas.example.com/common.json");
    }

    @Test
    void resolve_externalFetchFailurePropagates() {
        when(fetcher.fetch(anyString())).thenThrow(new TransportConnectionException(
                TransportConnectionException.Reason.IO, "Could not reach schemas.example.com"));
        JsonNode document = reader.read("""
                {"a": {"$ref": "https://schemas.example.com/common.json#/Pet"}}
                """);

        assertThatThrownBy(() -> resolver.resolve(document))
                .isInstanceOf(TransportConnectionException.class);
    }
}
