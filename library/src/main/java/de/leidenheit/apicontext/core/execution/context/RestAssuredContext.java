package de.leidenheit.apicontext.core.execution.context;

import io.restassured.specification.FilterableRequestSpecification;
import lombok.Builder;
import lombok.Data;

/**
 * Filled by the request filter while REST Assured sends, so the final request (with the
 * URI and headers REST Assured actually used) can be captured afterwards.
 */
@Data
@Builder
public class RestAssuredContext {
    private String latestUrl;
    private String latestHttpMethod;
    private FilterableRequestSpecification latestRequest;
}
