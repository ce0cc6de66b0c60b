package de.leidenheit.apicontext.core.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class RequestDefinition {
    private String method;
    private String path;
    private Map<String, String> headers;
    private Map<String, String> queryParams;
    private RequestBody body;
}
