package de.leidenheit.apicontext.core.execution;

import de.leidenheit.apicontext.core.context.ApiContextOptions;
import de.leidenheit.apicontext.core.exception.ApiContextResourceException;
import de.leidenheit.apicontext.core.exception.ApiContextTransportException;
import de.leidenheit.apicontext.core.execution.context.ExecutionResult;
import de.leidenheit.apicontext.core.execution.context.RestAssuredContext;
import de.leidenheit.apicontext.core.model.CapturedRequest;
import de.leidenheit.apicontext.core.model.CapturedResponse;
import de.leidenheit.apicontext.core.model.FormField;
import de.leidenheit.apicontext.core.model.RequestBody;
import de.leidenheit.apicontext.core.model.RequestDefinition;
import de.leidenheit.apicontext.infrastructure.utils.IOUtils;
import io.restassured.RestAssured;
import io.restassured.config.DecoderConfig;
import io.restassured.config.EncoderConfig;
import io.restassured.config.MultiPartConfig;
import io.restassured.config.RestAssuredConfig;
import io.restassured.http.Header;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Slf4j
public class RestAssuredRequestExecutor implements RequestExecutor {

    public static final String HEADER_CONTENT_TYPE = "Content-Type";

    private final ApiContextOptions options;
    private final RestAssuredConfig restAssuredConfig;

    public RestAssuredRequestExecutor(final ApiContextOptions options) {
        this.options = options;
        // caller-supplied content types are sent as they are; bodies without a declared charset are UTF-8
        var utf8 = StandardCharsets.UTF_8.name();
        this.restAssuredConfig = RestAssuredConfig.config()
                .encoderConfig(EncoderConfig.encoderConfig()
                        .defaultContentCharset(utf8)
                        .appendDefaultContentCharsetToContentTypeIfUndefined(false))
                .decoderConfig(DecoderConfig.decoderConfig()
                        .defaultContentCharset(utf8))
                .multiPartConfig(MultiPartConfig.multiPartConfig()
                        .defaultCharset(utf8));
    }

    @Override
    public ExecutionResult execute(final RequestDefinition requestDefinition) {
        RestAssuredContext restAssuredContext = RestAssuredContext.builder().build();

        var requestSpecification = buildRequest(requestDefinition, restAssuredContext);
        var response = makeRequest(requestSpecification, requestDefinition);

        return ExecutionResult.builder()
                .request(captureRequest(restAssuredContext))
                .response(captureResponse(response))
                .build();
    }

    private RequestSpecification buildRequest(final RequestDefinition requestDefinition,
                                              final RestAssuredContext restAssuredContext) {
        var requestSpecification = RestAssured
                .given()
                .config(restAssuredConfig)
                .filter((requestSpec, responseSpec, ctx) -> {
                    restAssuredContext.setLatestUrl(requestSpec.getURI());
                    restAssuredContext.setLatestHttpMethod(requestSpec.getMethod());
                    restAssuredContext.setLatestRequest(requestSpec);

                    return ctx.next(requestSpec, responseSpec);
                })
                .filter(new DebugLoggingFilter(options::isDebug));

        // apply query params
        if (Objects.nonNull(requestDefinition.getQueryParams()) && !requestDefinition.getQueryParams().isEmpty()) {
            requestSpecification.queryParams(requestDefinition.getQueryParams());
        }

        var body = Objects.requireNonNullElse(requestDefinition.getBody(), RequestBody.none());
        switch (body.getType()) {
            case NONE -> applyHeaders(requestSpecification, requestDefinition.getHeaders(), false);
            case FORM -> {
                // the multipart content type with its boundary replaces any accumulated one
                applyHeaders(requestSpecification, requestDefinition.getHeaders(), true);
                applyFormFields(requestSpecification, body.getFormFields());
            }
            case RAW -> {
                applyHeaders(requestSpecification, requestDefinition.getHeaders(), false);
                requestSpecification.body(Objects.requireNonNullElse(body.getPayload(), ""));
            }
        }
        return requestSpecification;
    }

    private void applyHeaders(final RequestSpecification requestSpecification,
                              final Map<String, String> headers,
                              final boolean skipContentType) {
        if (Objects.isNull(headers)) return;
        headers.forEach((name, value) -> {
            if (skipContentType && HEADER_CONTENT_TYPE.equalsIgnoreCase(name)) {
                log.debug("Ignoring header '{}: {}' in favour of the multipart content type", name, value);
                return;
            }
            requestSpecification.header(name, value);
        });
    }

    private void applyFormFields(final RequestSpecification requestSpecification, final List<FormField> formFields) {
        if (Objects.isNull(formFields)) return;
        for (FormField formField : formFields) {
            switch (formField.getKind()) {
                case TEXT -> requestSpecification.multiPart(formField.getKey(), formField.getValue());
                case FILE -> {
                    if (!IOUtils.isReadableFile(formField.getValue())) {
                        throw new ApiContextResourceException(
                                "Cannot open file '%s' for form field '%s'".formatted(formField.getValue(), formField.getKey()));
                    }
                    requestSpecification.multiPart(formField.getKey(), new File(formField.getValue()));
                }
            }
        }
    }

    private Response makeRequest(final RequestSpecification requestSpecification,
                                 final RequestDefinition requestDefinition) {
        var method = requestDefinition.getMethod().toUpperCase(Locale.ROOT);
        var url = options.getBaseUrl() + requestDefinition.getPath();

        try {
            return switch (method) {
                case "GET" -> requestSpecification.get(url);
                case "POST" -> requestSpecification.post(url);
                case "PUT" -> requestSpecification.put(url);
                case "DELETE" -> requestSpecification.delete(url);
                case "OPTIONS" -> requestSpecification.options(url);
                case "PATCH" -> requestSpecification.patch(url);
                case "HEAD" -> requestSpecification.head(url);
                default -> requestSpecification.request(method, url);
            };
        } catch (Exception e) {
            throw new ApiContextTransportException(
                    "Sending %s request to '%s' failed: %s".formatted(method, url, e), e);
        }
    }

    private CapturedRequest captureRequest(final RestAssuredContext restAssuredContext) {
        var request = restAssuredContext.getLatestRequest();
        if (Objects.isNull(request)) {
            return null;
        }
        Map<String, String> headers = new LinkedHashMap<>();
        request.getHeaders().forEach(header -> headers.put(header.getName(), header.getValue()));
        if (Objects.nonNull(request.getContentType())) {
            headers.putIfAbsent(HEADER_CONTENT_TYPE, request.getContentType());
        }
        Object body = request.getBody();
        return CapturedRequest.builder()
                .method(restAssuredContext.getLatestHttpMethod())
                .uri(restAssuredContext.getLatestUrl())
                .headers(headers)
                .body(Objects.nonNull(body) ? body.toString() : null)
                .build();
    }

    private CapturedResponse captureResponse(final Response response) {
        Map<String, List<String>> headers = response.getHeaders().asList().stream()
                .collect(Collectors.groupingBy(
                        Header::getName,
                        () -> new TreeMap<>(String.CASE_INSENSITIVE_ORDER),
                        Collectors.mapping(Header::getValue, Collectors.toList())));
        return CapturedResponse.builder()
                .statusCode(response.getStatusCode())
                .body(response.asString())
                .headers(headers)
                .build();
    }
}
