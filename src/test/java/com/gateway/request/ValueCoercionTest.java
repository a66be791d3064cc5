package com.gateway.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.exception.TypeMismatchException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueCoercionTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void coerce_integerFromText() throws Exception {
        assertThat(ValueCoercion.coerce("id", "42", schema("{\"type\":\"integer\"}"))).isEqualTo(42L);
        assertThat(ValueCoercion.coerce("id", 7, schema("{\"type\":\"integer\"}"))).isEqualTo(7L);
    }

    @Test
    void coerce_invalidIntegerNamesTheParameter() throws Exception {
        assertThatThrownBy(() -> ValueCoercion.coerce("id", "abc", schema("{\"type\":\"integer\"}")))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessage("Parameter 'id' is not a valid integer");
        assertThatThrownBy(() -> ValueCoercion.coerce("id", "1.5", schema("{\"type\":\"integer\"}")))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    void coerce_numberAndBoolean() throws Exception {
        assertThat(ValueCoercion.coerce("price", "9.5", schema("{\"type\":\"number\"}"))).isEqualTo(9.5d);
        assertThat(ValueCoercion.coerce("flag", "TRUE", schema("{\"type\":\"boolean\"}"))).isEqualTo(true);
        assertThat(ValueCoercion.coerce("flag", "false", schema("{\"type\":\"boolean\"}"))).isEqualTo(false);
        assertThatThrownBy(() -> ValueCoercion.coerce("flag", "yes", schema("{\"type\":\"boolean\"}")))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("boolean");
    }

    @Test
    void coerce_arrayFromCommaSeparatedText() throws Exception {
        JsonNode schema = schema("{\"type\":\"array\",\"items\":{\"type\":\"integer\"}}");

        assertThat(ValueCoercion.coerce("ids", "1, 2,3", schema)).isEqualTo(List.of(1L, 2L, 3L));
        assertThat(ValueCoercion.coerce("ids", List.of("4"), schema)).isEqualTo(List.of(4L));
    }

    @Test
    void coerce_objectFromJsonText() throws Exception {
        Object value = ValueCoercion.coerce("filter", "{\"name\":\"rex\"}", schema("{\"type\":\"object\"}"));

        assertThat(value).isEqualTo(Map.of("name", "rex"));
        assertThatThrownBy(() -> ValueCoercion.coerce("filter", "not json", schema("{\"type\":\"object\"}")))
                .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    void coerce_withoutTypeReturnsValueUnchanged() throws Exception {
        Object value = new Object();
        assertThat(ValueCoercion.coerce("x", value, null)).isSameAs(value);
        assertThat(ValueCoercion.coerce("x", value, schema("{}"))).isSameAs(value);
        assertThat(ValueCoercion.coerce("x", 5, schema("{\"type\":\"string\"}"))).isEqualTo("5");
    }

    private static JsonNode schema(String json) throws Exception {
        return objectMapper.readTree(json);
    }
}
