package de.leidenheit.apicontext.core.evaluation;

import com.google.common.base.Strings;
import de.leidenheit.apicontext.core.context.ApiContext;
import de.leidenheit.apicontext.core.exception.ApiContextAssertionException;
import de.leidenheit.apicontext.core.exception.ApiContextParseException;
import de.leidenheit.apicontext.infrastructure.io.JsonSchemaReader;
import de.leidenheit.apicontext.infrastructure.utils.NumericAwareNodeComparator;
import de.leidenheit.apicontext.infrastructure.validation.JsonSchemaValidator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks against the last captured response and the variable scope of an {@link ApiContext}.
 * <p>
 * Every check returns normally on success and throws otherwise. Only the {@code store*} methods
 * change state, by writing into the scope.
 */
@Slf4j
public class ResponseAssertions {

    private final ApiContext context;
    private final JsonPathEvaluator jsonPathEvaluator;
    private final JsonSchemaValidator jsonSchemaValidator;

    public ResponseAssertions(final ApiContext context) {
        this(context, new JsonPathEvaluator(), new JsonSchemaValidator());
    }

    public ResponseAssertions(final ApiContext context,
                              final JsonPathEvaluator jsonPathEvaluator,
                              final JsonSchemaValidator jsonSchemaValidator) {
        this.context = context;
        this.jsonPathEvaluator = jsonPathEvaluator;
        this.jsonSchemaValidator = jsonSchemaValidator;
    }

    public void assertStatusCode(final int expectedStatusCode) {
        var response = context.requireLastResponse();
        if (expectedStatusCode != response.getStatusCode()) {
            throw new ApiContextAssertionException("expected status code to be %d, but actual is %d.%n Response body: %s"
                    .formatted(expectedStatusCode, response.getStatusCode(), response.getBody()));
        }
    }

    public void assertValidJson() {
        jsonPathEvaluator.readTree(context.requireLastResponse().getBody());
    }

    public void assertMatchesJson(final String expectedJson) {
        var actual = StringUtils.strip(context.requireLastResponse().getBody(), "\n");
        var expected = context.getResolver().resolveString(expectedJson);

        var actualNode = jsonPathEvaluator.readTree(actual);
        var expectedNode = jsonPathEvaluator.readTree(expected);
        if (!NumericAwareNodeComparator.jsonEquals(actualNode, expectedNode)) {
            throw new ApiContextAssertionException("expected json %s, does not match actual: %s".formatted(expected, actual));
        }
    }

    public void assertHeader(final String name, final String expectedValue) {
        var actualValue = context.requireLastResponse().getHeader(name);
        var expected = context.getResolver().resolveString(expectedValue);
        if (!Objects.equals(actualValue, expected)) {
            throw new ApiContextAssertionException("expected header %s to have value %s. actual : %s"
                    .formatted(name, expected, actualValue));
        }
    }

    public void assertMatchesJsonSchema(final String relativePath) {
        var body = context.requireLastResponse().getBody();
        var schema = JsonSchemaReader.readSchema(context.getOptions().getJsonSchemasPath(), relativePath);
        // malformed bodies are reported as such, not as schema violations
        jsonPathEvaluator.readTree(body);

        var result = jsonSchemaValidator.validate(schema, body);
        if (result.isInvalid()) {
            throw new ApiContextAssertionException("the response is not valid according to the specified schema %s%n %s"
                    .formatted(relativePath, result.getViolations()));
        }
    }

    public void assertJsonPathValue(final String pathExpression, final String expectedValue) {
        var expected = context.getResolver().resolveString(expectedValue);
        var actualNode = jsonPathEvaluator.evaluate(context.requireLastResponse().getBody(), pathExpression);

        var kind = JsonValueKind.of(actualNode);
        var expectedNode = kind.coerce(expected, jsonPathEvaluator.getMapper());
        if (!NumericAwareNodeComparator.jsonEquals(actualNode, expectedNode)) {
            throw new ApiContextAssertionException("expected json path %s to have value %s but it is %s"
                    .formatted(pathExpression, JsonValueKind.stringify(expectedNode), JsonValueKind.stringify(actualNode)));
        }
    }

    public void assertJsonPathMatches(final String pathExpression, final String pattern) {
        var actualNode = jsonPathEvaluator.evaluate(context.requireLastResponse().getBody(), pathExpression);
        var actual = JsonValueKind.stringify(actualNode);
        if (!compile(pattern).matcher(actual).find()) {
            throw new ApiContextAssertionException("%s does not match: %s".formatted(actual, pattern));
        }
    }

    public void assertJsonPathPresent(final String pathExpression) {
        var actualNode = jsonPathEvaluator.evaluate(context.requireLastResponse().getBody(), pathExpression);
        if (JsonValueKind.NULL == JsonValueKind.of(actualNode)) {
            throw new ApiContextAssertionException("the json path %s was not present in the response".formatted(pathExpression));
        }
    }

    public void assertJsonPathCount(final String pathExpression, final int expectedCount) {
        var actualNode = jsonPathEvaluator.evaluate(context.requireLastResponse().getBody(), pathExpression);
        if (!actualNode.isArray()) {
            throw new ApiContextAssertionException("the json path %s is not an array. Found %s"
                    .formatted(pathExpression, JsonValueKind.stringify(actualNode)));
        }
        if (actualNode.size() != expectedCount) {
            throw new ApiContextAssertionException("the value %s does not have count %d but %d"
                    .formatted(actualNode, expectedCount, actualNode.size()));
        }
    }

    public void assertBodyContains(final String expectedSubstring) {
        var body = StringUtils.strip(context.requireLastResponse().getBody(), "\n");
        var expected = context.getResolver().resolveString(expectedSubstring);
        if (!body.contains(expected)) {
            throw new ApiContextAssertionException("%s does not contain %s".formatted(body, expected));
        }
    }

    public void assertBodyMatches(final String pattern) {
        var body = context.requireLastResponse().getBody();
        if (!compile(pattern).matcher(body).find()) {
            throw new ApiContextAssertionException("%s does not match pattern: %s".formatted(body, pattern));
        }
    }

    public void storeResponseHeader(final String name, final String scopeKey) {
        var actualValue = context.requireLastResponse().getHeader(name);
        context.getScope().store(scopeKey, Strings.nullToEmpty(actualValue));
    }

    public void storeJsonPathValue(final String pathExpression, final String scopeKey) {
        var actualNode = jsonPathEvaluator.evaluate(context.requireLastResponse().getBody(), pathExpression);
        context.getScope().store(scopeKey, JsonValueKind.stringify(actualNode));
    }

    public void assertScopeVariable(final String scopeKey, final String expectedValue) {
        var actualValue = Strings.nullToEmpty(context.getScope().get(scopeKey));
        if (!actualValue.equals(expectedValue)) {
            throw new ApiContextAssertionException("expected scope variable %s to have value %s. actual : %s"
                    .formatted(scopeKey, expectedValue, actualValue));
        }
    }

    private Pattern compile(final String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new ApiContextParseException("Invalid regular expression '%s': %s".formatted(pattern, e.getDescription()), e);
        }
    }
}
