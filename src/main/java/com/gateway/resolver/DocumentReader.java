package com.gateway.resolver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.gateway.exception.InvalidSpecificationException;
import org.springframework.stereotype.Component;

/**
 * Parses specification text into a Jackson tree. Content starting with <code>{</code> or
 * <code>[</code> is read as JSON, anything else as YAML.
 */
@Component
public class DocumentReader {

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final YAMLMapper yamlMapper = new YAMLMapper();

    public JsonNode read(String content) {
        if (content == null || content.isBlank()) {
            throw new InvalidSpecificationException("document", "content is empty");
        }
        String trimmed = content.stripLeading();
        boolean json = trimmed.startsWith("{") || trimmed.startsWith("[");
        try {
            JsonNode node = json ? jsonMapper.readTree(trimmed) : yamlMapper.readTree(trimmed);
            if (node == null || !node.isObject()) {
                throw new InvalidSpecificationException("document", "expected an object at the document root");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new InvalidSpecificationException("document",
                    "not valid " + (json ? "JSON" : "YAML") + " (" + e.getOriginalMessage() + ")");
        }
    }
}
