package de.leidenheit.apicontext.core.context;

import com.google.common.base.Strings;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

@Slf4j
@Data
@Builder
public class ApiContextOptions {

    public static final String PROPERTY_BASE_URL = "apicontext.base-url";
    public static final String PROPERTY_DEBUG = "apicontext.debug";
    public static final String PROPERTY_JSON_SCHEMAS_PATH = "apicontext.json-schemas-path";

    public static final String DEFAULT_BASE_URL = "http://localhost:8080";
    public static final String DEFAULT_JSON_SCHEMAS_PATH = "schemas";

    private String baseUrl;
    private boolean debug;
    private String jsonSchemasPath;

    public static ApiContextOptions ofDefault() {
        return ApiContextOptions.builder()
                .baseUrl(DEFAULT_BASE_URL)
                .debug(false)
                .jsonSchemasPath(DEFAULT_JSON_SCHEMAS_PATH)
                .build();
    }

    /**
     * Defaults overlaid with the {@code apicontext.*} JVM system properties that are set.
     */
    public static ApiContextOptions fromSystemProperties() {
        var options = ofDefault();
        readFromSystemProperties(PROPERTY_BASE_URL).ifPresent(options::setBaseUrl);
        readFromSystemProperties(PROPERTY_DEBUG).map(Boolean::parseBoolean).ifPresent(options::setDebug);
        readFromSystemProperties(PROPERTY_JSON_SCHEMAS_PATH).ifPresent(options::setJsonSchemasPath);
        return options;
    }

    private static Optional<String> readFromSystemProperties(final String property) {
        var propertyValue = System.getProperty(property);
        if (Strings.isNullOrEmpty(propertyValue)) return Optional.empty();

        log.debug("Reading system property '{}': {}", property, propertyValue);
        return Optional.of(propertyValue);
    }
}
