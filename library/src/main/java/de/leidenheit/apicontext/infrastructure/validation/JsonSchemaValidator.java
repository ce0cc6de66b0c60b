package de.leidenheit.apicontext.infrastructure.validation;

import de.leidenheit.apicontext.core.exception.ApiContextParseException;
import lombok.extern.slf4j.Slf4j;
import org.everit.json.schema.Schema;
import org.everit.json.schema.SchemaException;
import org.everit.json.schema.ValidationException;
import org.everit.json.schema.loader.SchemaLoader;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Validates JSON documents against JSON schema documents (drafts 4, 6 and 7).
 */
@Slf4j
public class JsonSchemaValidator {

    /**
     * @param schemaContent the schema document
     * @param document      a well-formed JSON document
     * @throws ApiContextParseException if the schema cannot be loaded
     */
    public JsonSchemaValidationResult validate(final String schemaContent, final String document) {
        var schema = loadSchema(schemaContent);
        try {
            schema.validate(new JSONTokener(document).nextValue());
            return JsonSchemaValidationResult.valid();
        } catch (ValidationException e) {
            log.debug("Schema validation failed with {} violation(s)", e.getViolationCount());
            return JsonSchemaValidationResult.invalid(e.getAllMessages());
        } catch (JSONException e) {
            throw new ApiContextParseException("Cannot read document for schema validation: %s".formatted(e.getMessage()), e);
        }
    }

    private Schema loadSchema(final String schemaContent) {
        try {
            JSONObject rawSchema = new JSONObject(new JSONTokener(schemaContent));
            return SchemaLoader.load(rawSchema);
        } catch (JSONException | SchemaException e) {
            throw new ApiContextParseException("Invalid json schema: %s".formatted(e.getMessage()), e);
        }
    }
}
