package de.leidenheit.apicontext.core.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import de.leidenheit.apicontext.core.exception.ApiContextParseException;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The kinds a value selected from a JSON document can have. An expected value given as text is
 * parsed according to the kind of the actual value it is compared with.
 */
public enum JsonValueKind {

    BOOLEAN {
        @Override
        JsonNode parse(final String text, final ObjectMapper mapper) {
            if ("true".equalsIgnoreCase(text)) return BooleanNode.TRUE;
            if ("false".equalsIgnoreCase(text)) return BooleanNode.FALSE;
            throw new IllegalArgumentException("not a boolean");
        }
    },
    INTEGER {
        @Override
        JsonNode parse(final String text, final ObjectMapper mapper) {
            return BigIntegerNode.valueOf(new BigInteger(text.trim()));
        }
    },
    FLOAT {
        @Override
        JsonNode parse(final String text, final ObjectMapper mapper) {
            return DoubleNode.valueOf(Double.parseDouble(text.trim()));
        }
    },
    STRING {
        @Override
        JsonNode parse(final String text, final ObjectMapper mapper) {
            return TextNode.valueOf(text);
        }
    },
    ARRAY {
        @Override
        JsonNode parse(final String text, final ObjectMapper mapper) throws JsonProcessingException {
            var node = mapper.readTree(text);
            if (Objects.isNull(node) || !node.isArray()) throw new IllegalArgumentException("not an array");
            return node;
        }
    },
    OBJECT {
        @Override
        JsonNode parse(final String text, final ObjectMapper mapper) throws JsonProcessingException {
            var node = mapper.readTree(text);
            if (Objects.isNull(node) || !node.isObject()) throw new IllegalArgumentException("not an object");
            return node;
        }
    },
    NULL {
        @Override
        JsonNode parse(final String text, final ObjectMapper mapper) {
            if ("null".equals(text.trim())) return NullNode.getInstance();
            throw new IllegalArgumentException("not null");
        }
    };

    abstract JsonNode parse(final String text, final ObjectMapper mapper) throws JsonProcessingException;

    /**
     * Parses {@code text} into a value of this kind.
     *
     * @throws ApiContextParseException if the text does not denote a value of this kind
     */
    public JsonNode coerce(final String text, final ObjectMapper mapper) {
        try {
            return parse(text, mapper);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ApiContextParseException(
                    "Cannot parse '%s' as %s: %s".formatted(text, name().toLowerCase(), e.getMessage()), e);
        }
    }

    public static JsonValueKind of(final JsonNode node) {
        if (Objects.isNull(node) || node.isNull() || node.isMissingNode()) return NULL;
        if (node.isBoolean()) return BOOLEAN;
        if (node.isIntegralNumber()) return INTEGER;
        if (node.isNumber()) return FLOAT;
        if (node.isTextual()) return STRING;
        if (node.isArray()) return ARRAY;
        if (node.isObject()) return OBJECT;
        // binary and POJO nodes only appear in trees built by hand
        return STRING;
    }

    /**
     * The text form of a value: strings as they are, other scalars in their JSON notation and
     * containers as compact JSON.
     */
    public static String stringify(final JsonNode node) {
        if (Objects.isNull(node) || node.isMissingNode()) return "null";
        if (node.isValueNode()) return node.asText();
        return node.toString();
    }
}
