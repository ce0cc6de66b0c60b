package de.leidenheit.apicontext.core.context;

import de.leidenheit.apicontext.core.exception.ApiContextIllegalStateException;
import de.leidenheit.apicontext.core.exception.ApiContextInterruptException;
import de.leidenheit.apicontext.core.execution.RequestExecutor;
import de.leidenheit.apicontext.core.execution.RestAssuredRequestExecutor;
import de.leidenheit.apicontext.core.model.CapturedRequest;
import de.leidenheit.apicontext.core.model.CapturedResponse;
import de.leidenheit.apicontext.core.model.FormField;
import de.leidenheit.apicontext.core.model.RequestBody;
import de.leidenheit.apicontext.core.model.RequestDefinition;
import de.leidenheit.apicontext.core.resolving.ExpressionResolver;
import de.leidenheit.apicontext.core.resolving.ScopeExpressionResolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * State shared by the steps of one scenario: configuration, the headers and query parameters
 * accumulated for the next request, the variable scope and the last request/response pair.
 * <p>
 * Not thread-safe; one instance serves one scenario at a time.
 */
@Slf4j
public class ApiContext {

    @Getter
    private final ApiContextOptions options;
    @Getter
    private final VariableScope scope = new VariableScope();
    @Getter
    private final ExpressionResolver resolver = new ScopeExpressionResolver(scope);
    private final RequestExecutor requestExecutor;

    private final Map<String, String> headers = new LinkedHashMap<>();
    private final Map<String, String> queryParams = new LinkedHashMap<>();
    @Getter
    private CapturedRequest lastRequest;
    @Getter
    private CapturedResponse lastResponse;

    public ApiContext() {
        this(ApiContextOptions.ofDefault());
    }

    public ApiContext(final ApiContextOptions options) {
        this.options = options;
        this.requestExecutor = new RestAssuredRequestExecutor(options);
    }

    public ApiContext(final ApiContextOptions options, final RequestExecutor requestExecutor) {
        this.options = options;
        this.requestExecutor = requestExecutor;
    }

    public ApiContext withBaseUrl(final String baseUrl) {
        options.setBaseUrl(baseUrl);
        return this;
    }

    public ApiContext withDebug(final boolean debug) {
        options.setDebug(debug);
        return this;
    }

    public ApiContext withJsonSchemasPath(final String jsonSchemasPath) {
        options.setJsonSchemasPath(jsonSchemasPath);
        return this;
    }

    /**
     * Forgets everything a scenario accumulated: headers, query parameters, the last
     * request/response pair and the variable scope.
     */
    public void reset() {
        log.debug("Resetting api context");
        headers.clear();
        queryParams.clear();
        scope.clear();
        lastRequest = null;
        lastResponse = null;
    }

    /**
     * Sets a header for the following requests. The value is taken literally, scope references are not resolved.
     */
    public void setHeader(final String name, final String value) {
        log.debug("Setting header '{}' with value '{}'", name, value);
        headers.put(name, value);
    }

    /**
     * Sets several headers for the following requests, resolving scope references in the values.
     */
    public void setHeaders(final Map<String, String> headersToSet) {
        headersToSet.forEach((name, value) -> setHeader(name, resolver.resolveString(value)));
    }

    public void setQueryParam(final String name, final String value) {
        var resolvedValue = resolver.resolveString(value);
        log.debug("Setting query param '{}' with value '{}'", name, resolvedValue);
        queryParams.put(name, resolvedValue);
    }

    public void setQueryParams(final Map<String, String> queryParamsToSet) {
        queryParamsToSet.forEach(this::setQueryParam);
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public Map<String, String> getQueryParams() {
        return Collections.unmodifiableMap(queryParams);
    }

    /**
     * Sends a request without body. Scope references in {@code path} are resolved in all {@code send*} methods.
     */
    public CapturedResponse sendRequest(final String method, final String path) {
        return send(method, path, RequestBody.none());
    }

    /**
     * Sends a multipart form; values of text and file fields are scope-resolved.
     */
    public CapturedResponse sendRequestWithFormBody(final String method, final String path, final List<FormField> formFields) {
        var resolvedFields = formFields.stream()
                .map(field -> FormField.builder()
                        .key(field.getKey())
                        .value(resolver.resolveString(field.getValue()))
                        .kind(field.getKind())
                        .build())
                .collect(Collectors.toList());
        return send(method, path, RequestBody.form(resolvedFields));
    }

    public CapturedResponse sendRequestWithBody(final String method, final String path, final String payload) {
        return send(method, path, RequestBody.raw(resolver.resolveString(payload)));
    }

    private CapturedResponse send(final String method, final String path, final RequestBody body) {
        var requestDefinition = RequestDefinition.builder()
                .method(method)
                .path(resolver.resolveString(path))
                .headers(new LinkedHashMap<>(headers))
                .queryParams(new LinkedHashMap<>(queryParams))
                .body(body)
                .build();

        var result = requestExecutor.execute(requestDefinition);
        lastRequest = result.getRequest();
        lastResponse = result.getResponse();
        log.debug("{} {} answered with status {}", method, requestDefinition.getPath(), lastResponse.getStatusCode());
        return lastResponse;
    }

    /**
     * @throws ApiContextIllegalStateException if no request has been sent in this scenario yet
     */
    public CapturedResponse requireLastResponse() {
        if (Objects.isNull(lastResponse)) {
            throw new ApiContextIllegalStateException("No response available yet; send a request first");
        }
        return lastResponse;
    }

    public void storeScopeData(final String key, final String value) {
        scope.store(key, value);
    }

    public void waitFor(final Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiContextInterruptException("Interrupted while waiting for %s".formatted(duration), e);
        }
    }
}
