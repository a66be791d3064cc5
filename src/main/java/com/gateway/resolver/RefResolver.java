package com.gateway.resolver;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gateway.exception.MalformedReferenceException;
import com.gateway.exception.UnsupportedReferenceException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

/**
 * Expands every {@code $ref} of a specification document into the value it points to.
 * <p>
 * Internal references ({@code #/a/b}) are navigated from the root of the document that
 * contains them. Absolute {@code http(s)} references are split into a base document and a
 * fragment; each base document is fetched once per {@link #resolve} call and its own internal
 * references are resolved against it. A reference met again while it is still being expanded
 * is replaced by a circular marker {@code {"$ref": ref, "circular": true}} so resolution always
 * terminates, and markers left by an earlier pass are kept as-is so resolving twice yields the
 * same tree.
 * <p>
 * All bookkeeping lives in a per-call {@link Resolution}, so one instance can serve concurrent
 * registrations.
 */
@Component
@Slf4j
public class RefResolver {

    public static final String REF = "$ref";
    public static final String CIRCULAR = "circular";

    private final DocumentFetcher fetcher;
    private final DocumentReader reader;

    public RefResolver(DocumentFetcher fetcher, DocumentReader reader) {
        this.fetcher = fetcher;
        this.reader = reader;
    }

    /**
     * Returns a copy of {@code document} with all references expanded. The input is not modified.
     *
     * @param document The parsed specification document.
     * @return The resolved document.
     * @throws MalformedReferenceException   if a pointer does not locate a value.
     * @throws UnsupportedReferenceException if a reference is a relative file path.
     */
    public JsonNode resolve(JsonNode document) {
        Resolution resolution = new Resolution();
        JsonNode resolved = resolveNode(document, document, "", resolution);
        log.debug("Resolved {} distinct references ({} external documents)",
                resolution.resolved.size(), resolution.externalDocuments.size());
        return resolved;
    }

    public static boolean isCircularMarker(JsonNode node) {
        return node != null && node.isObject() && node.has(REF) && node.path(CIRCULAR).asBoolean(false);
    }

    private JsonNode resolveNode(JsonNode node, JsonNode root, String documentBase, Resolution resolution) {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            JsonNode ref = node.get(REF);
            if (ref != null && ref.isTextual() && !isCircularMarker(node)) {
                return resolveReference(ref.asText(), root, documentBase, resolution);
            }
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            node.properties().forEach(field ->
                    copy.set(field.getKey(), resolveNode(field.getValue(), root, documentBase, resolution)));
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> copy.add(resolveNode(element, root, documentBase, resolution)));
            return copy;
        }
        return node;
    }

    private JsonNode resolveReference(String ref, JsonNode root, String documentBase, Resolution resolution) {
        JsonNode targetRoot;
        String targetBase;
        String fragment;
        String key;

        if (ref.startsWith("#")) {
            targetRoot = root;
            targetBase = documentBase;
            fragment = ref.substring(1);
            key = documentBase + ref;
        } else if (ref.startsWith("http://") || ref.startsWith("https://")) {
            int hash = ref.indexOf('#');
            targetBase = hash >= 0 ? ref.substring(0, hash) : ref;
            fragment = hash >= 0 ? ref.substring(hash + 1) : "";
            targetRoot = resolution.externalDocument(targetBase);
            key = targetBase + "#" + fragment;
        } else {
            throw new UnsupportedReferenceException("Relative references are not supported: " + ref);
        }

        if (resolution.inProgress.contains(key)) {
            log.debug("Circular reference detected at {}", ref);
            ObjectNode marker = JsonNodeFactory.instance.objectNode();
            marker.put(REF, ref);
            marker.put(CIRCULAR, true);
            return marker;
        }
        JsonNode cached = resolution.resolved.get(key);
        if (cached != null) {
            return cached;
        }

        JsonNode target = locate(targetRoot, fragment, ref);
        resolution.inProgress.push(key);
        try {
            JsonNode resolved = resolveNode(target, targetRoot, targetBase, resolution);
            resolution.resolved.put(key, resolved);
            return resolved;
        } finally {
            resolution.inProgress.pop();
        }
    }

    private JsonNode locate(JsonNode root, String fragment, String ref) {
        if (fragment.isEmpty()) {
            return root;
        }
        JsonPointer pointer;
        try {
            pointer = JsonPointer.compile(UriUtils.decode(fragment, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new MalformedReferenceException("Invalid JSON pointer in reference: " + ref, e);
        }
        JsonNode target = root.at(pointer);
        if (target.isMissingNode()) {
            throw new MalformedReferenceException("Reference target not found: " + ref);
        }
        return target;
    }

    /**
     * State of a single {@link #resolve} call.
     */
    private final class Resolution {

        private final Deque<String> inProgress = new ArrayDeque<>();
        private final Map<String, JsonNode> resolved = new HashMap<>();
        private final Map<String, JsonNode> externalDocuments = new HashMap<>();

        private JsonNode externalDocument(String url) {
            JsonNode document = externalDocuments.get(url);
            if (document == null) {
                document = reader.read(fetcher.fetch(url));
                externalDocuments.put(url, document);
            }
            return document;
        }
    }
}
