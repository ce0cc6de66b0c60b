package de.leidenheit.apicontext.infrastructure.validation;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class JsonSchemaValidationResult {

    private boolean invalid;
    @Builder.Default
    private final List<String> violations = new ArrayList<>();

    public static JsonSchemaValidationResult valid() {
        return JsonSchemaValidationResult.builder()
                .invalid(false)
                .build();
    }

    public static JsonSchemaValidationResult invalid(final List<String> violations) {
        return JsonSchemaValidationResult.builder()
                .invalid(true)
                .violations(new ArrayList<>(violations))
                .build();
    }
}
