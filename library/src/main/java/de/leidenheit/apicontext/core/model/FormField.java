package de.leidenheit.apicontext.core.model;

import de.leidenheit.apicontext.core.exception.ApiContextUnsupportedException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Arrays;

/**
 * One row of a multipart form body: the part name, its value and whether the value is literal
 * text or the path of a file to upload.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FormField {
    private String key;
    private String value;
    private FormFieldKind kind;

    @Getter
    @AllArgsConstructor
    public enum FormFieldKind {
        TEXT("text"),
        FILE("file");

        private final String value;

        public static FormFieldKind fromValue(final String value) {
            return Arrays.stream(values())
                    .filter(kind -> kind.getValue().equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new ApiContextUnsupportedException(
                            "Unsupported form field type '%s'; expected one of 'text' or 'file'".formatted(value)));
        }
    }
}
