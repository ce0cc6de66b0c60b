package de.leidenheit.apicontext.infrastructure.io;

import de.leidenheit.apicontext.core.exception.ApiContextResourceException;
import de.leidenheit.apicontext.infrastructure.utils.IOUtils;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class JsonSchemaReader {

    /**
     * Reads {@code {schemasPath}/{relativePath}} from disk on every call.
     *
     * @throws ApiContextResourceException if the file does not exist or cannot be read
     */
    public static String readSchema(final String schemasPath, final String relativePath) {
        var schemaPath = IOUtils.joinRelative(schemasPath, relativePath);
        var file = new File(schemaPath);
        if (!file.exists()) {
            throw new ApiContextResourceException("JSON schema file does not exist: %s".formatted(schemaPath));
        }
        try {
            return FileUtils.readFileToString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ApiContextResourceException("Cannot open json schema file: %s".formatted(e.getMessage()), e);
        }
    }

    private JsonSchemaReader() {}
}
