package com.gateway.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.exception.TypeMismatchException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts caller supplied parameter values to the type their schema declares. Values
 * without a schema, or with a type this class does not know, are passed through untouched.
 */
public final class ValueCoercion {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ValueCoercion() {
    }

    /**
     * @throws TypeMismatchException if the value cannot be read as the declared type.
     */
    public static Object coerce(String name, Object value, JsonNode schema) {
        String type = typeOf(schema);
        if (value == null || type == null) {
            return value;
        }
        return switch (type) {
            case "integer" -> toInteger(name, value);
            case "number" -> toNumber(name, value);
            case "boolean" -> toBoolean(name, value);
            case "array" -> toArray(name, value, schema.get("items"));
            case "object" -> toObject(name, value);
            case "string" -> value instanceof String ? value : String.valueOf(value);
            default -> value;
        };
    }

    /**
     * The declared type. JSON Schema 2020-12 allows a list such as {@code ["integer", "null"]},
     * in which case the first non-null entry is used.
     */
    private static String typeOf(JsonNode schema) {
        if (schema == null || !schema.hasNonNull("type")) {
            return null;
        }
        JsonNode type = schema.get("type");
        if (!type.isArray()) {
            return type.asText();
        }
        for (JsonNode entry : type) {
            if (!"null".equals(entry.asText())) {
                return entry.asText();
            }
        }
        return null;
    }

    private static Long toInteger(String name, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        try {
            return new BigDecimal(String.valueOf(value).trim()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new TypeMismatchException(name, "integer");
        }
    }

    private static Double toNumber(String name, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new TypeMismatchException(name, "number");
        }
    }

    private static Boolean toBoolean(String name, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if ("true".equals(text)) {
            return Boolean.TRUE;
        }
        if ("false".equals(text)) {
            return Boolean.FALSE;
        }
        throw new TypeMismatchException(name, "boolean");
    }

    private static List<Object> toArray(String name, Object value, JsonNode itemSchema) {
        Collection<?> items;
        if (value instanceof Collection<?> collection) {
            items = collection;
        } else if (value instanceof Object[] array) {
            items = Arrays.asList(array);
        } else if (value instanceof String text) {
            items = text.isEmpty() ? List.of() : Arrays.stream(text.split(",")).map(String::trim).toList();
        } else {
            throw new TypeMismatchException(name, "array");
        }
        List<Object> result = new ArrayList<>(items.size());
        for (Object item : items) {
            result.add(coerce(name, item, itemSchema));
        }
        return result;
    }

    private static Map<String, Object> toObject(String name, Object value) {
        if (value instanceof Map<?, ?> map) {
            return MAPPER.convertValue(map, new TypeReference<Map<String, Object>>() {
            });
        }
        if (value instanceof String text) {
            try {
                return MAPPER.readValue(text, new TypeReference<Map<String, Object>>() {
                });
            } catch (JsonProcessingException e) {
                throw new TypeMismatchException(name, "object");
            }
        }
        throw new TypeMismatchException(name, "object");
    }
}
