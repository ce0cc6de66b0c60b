package de.leidenheit.apicontext.core.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.JsonPathException;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import de.leidenheit.apicontext.core.exception.ApiContextAssertionException;
import de.leidenheit.apicontext.core.exception.ApiContextParseException;
import lombok.Getter;

import java.util.Objects;

/**
 * Parses JSON documents and evaluates JSON-path expressions against them.
 */
public class JsonPathEvaluator {

    @Getter
    private final ObjectMapper mapper;
    private final Configuration configuration;

    public JsonPathEvaluator() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public JsonPathEvaluator(final ObjectMapper mapper) {
        this.mapper = mapper;
        this.configuration = Configuration.builder()
                .jsonProvider(new JacksonJsonNodeJsonProvider(mapper))
                .mappingProvider(new JacksonMappingProvider(mapper))
                .build();
    }

    /**
     * @throws ApiContextParseException if the content is not exactly one JSON value
     */
    public JsonNode readTree(final String content) {
        try {
            var node = mapper.readTree(Objects.requireNonNullElse(content, ""));
            if (Objects.isNull(node) || node.isMissingNode()) {
                throw new ApiContextParseException("Expected a json document but the content is empty");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ApiContextParseException("Invalid json: %s".formatted(e.getOriginalMessage()), e);
        }
    }

    /**
     * Evaluates {@code pathExpression} against the JSON {@code document}.
     *
     * @return the selected value; a JSON {@code null} is returned as {@link NullNode}
     * @throws ApiContextParseException     if the document or the expression is malformed
     * @throws ApiContextAssertionException if the path does not exist in the document
     */
    public JsonNode evaluate(final String document, final String pathExpression) {
        var root = readTree(document);
        Object result;
        try {
            result = JsonPath.using(configuration).parse(root).read(pathExpression);
        } catch (PathNotFoundException e) {
            throw new ApiContextAssertionException(
                    "the json path %s does not exist in the response: %s".formatted(pathExpression, e.getMessage()), e);
        } catch (InvalidPathException e) {
            throw new ApiContextParseException(
                    "Invalid json path %s: %s".formatted(pathExpression, e.getMessage()), e);
        } catch (JsonPathException e) {
            throw new ApiContextParseException(
                    "Cannot evaluate json path %s: %s".formatted(pathExpression, e.getMessage()), e);
        }
        return toNode(result);
    }

    private JsonNode toNode(final Object result) {
        if (result instanceof JsonNode node) {
            return node;
        }
        // leaves come back unwrapped into plain java values
        JsonNode node = mapper.valueToTree(result);
        return Objects.isNull(node) ? NullNode.getInstance() : node;
    }
}
