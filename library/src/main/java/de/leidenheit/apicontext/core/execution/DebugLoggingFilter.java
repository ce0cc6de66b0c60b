package de.leidenheit.apicontext.core.execution;

import io.restassured.filter.Filter;
import io.restassured.filter.FilterContext;
import io.restassured.http.Headers;
import io.restassured.response.Response;
import io.restassured.specification.FilterableRequestSpecification;
import io.restassured.specification.FilterableResponseSpecification;
import io.restassured.specification.MultiPartSpecification;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Dumps the complete outgoing request and incoming response while debug mode is on.
 */
@Slf4j
public class DebugLoggingFilter implements Filter {

    private final BooleanSupplier debugEnabled;

    public DebugLoggingFilter(final BooleanSupplier debugEnabled) {
        this.debugEnabled = debugEnabled;
    }

    @Override
    public Response filter(final FilterableRequestSpecification requestSpec,
                           final FilterableResponseSpecification responseSpec,
                           final FilterContext ctx) {
        if (!debugEnabled.getAsBoolean()) {
            return ctx.next(requestSpec, responseSpec);
        }

        log.info("Request:\n{}", describeRequest(requestSpec));
        var response = ctx.next(requestSpec, responseSpec);
        log.info("Response:\n{}", describeResponse(response));
        return response;
    }

    private String describeRequest(final FilterableRequestSpecification requestSpec) {
        var dump = new StringBuilder()
                .append(requestSpec.getMethod()).append(' ').append(requestSpec.getURI()).append('\n');
        appendHeaders(dump, requestSpec.getHeaders());
        if (Objects.nonNull(requestSpec.getContentType())
                && !requestSpec.getHeaders().hasHeaderWithName("Content-Type")) {
            dump.append("Content-Type: ").append(requestSpec.getContentType()).append('\n');
        }
        dump.append('\n');
        if (!requestSpec.getMultiPartParams().isEmpty()) {
            for (MultiPartSpecification part : requestSpec.getMultiPartParams()) {
                dump.append("--part ").append(part.getControlName());
                if (Objects.nonNull(part.getFileName())) {
                    dump.append("; filename=").append(part.getFileName());
                } else {
                    dump.append(": ").append(part.getContent());
                }
                dump.append('\n');
            }
        } else if (Objects.nonNull(requestSpec.getBody())) {
            dump.append(requestSpec.<Object>getBody());
        }
        return dump.toString();
    }

    private String describeResponse(final Response response) {
        var dump = new StringBuilder()
                .append(response.getStatusLine()).append('\n');
        appendHeaders(dump, response.getHeaders());
        return dump.append('\n')
                .append(response.asString())
                .toString();
    }

    private void appendHeaders(final StringBuilder dump, final Headers headers) {
        headers.forEach(header -> dump.append(header.getName()).append(": ").append(header.getValue()).append('\n'));
    }
}
