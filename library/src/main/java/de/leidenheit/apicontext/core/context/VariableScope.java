package de.leidenheit.apicontext.core.context;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-scenario key/value store used to pass values between steps. Values are always strings.
 */
@Slf4j
public class VariableScope {

    private final Map<String, String> variables = new LinkedHashMap<>();

    public void store(final String key, final String value) {
        log.debug("Storing scope variable '{}' with value '{}'", key, value);
        variables.put(key, value);
    }

    /**
     * @return the stored value or {@code null} if the key was never stored
     */
    public String get(final String key) {
        return variables.get(key);
    }

    public void clear() {
        variables.clear();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(variables);
    }
}
