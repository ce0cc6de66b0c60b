package de.leidenheit.apicontext.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Snapshot of a received response. Created once per request and replaced wholesale by the next one.
 */
@Value
@Builder
public class CapturedResponse {

    int statusCode;
    String body;
    Map<String, List<String>> headers;

    /**
     * @return the first value of the header, or {@code null} if the response did not carry it
     */
    public String getHeader(final String name) {
        var values = headers.get(name);
        if (Objects.isNull(values) || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    public static class CapturedResponseBuilder {

        public CapturedResponseBuilder headers(final Map<String, List<String>> headers) {
            var caseInsensitive = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
            headers.forEach((name, values) -> caseInsensitive.put(name, List.copyOf(values)));
            this.headers = Collections.unmodifiableMap(caseInsensitive);
            return this;
        }
    }
}
