package de.leidenheit.apicontext.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CapturedRequest {

    String method;
    String uri;
    Map<String, String> headers;
    String body;
}
