package de.leidenheit.apicontext.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RequestBody {
    private RequestBodyType type;
    private List<FormField> formFields;
    private String payload;

    public static RequestBody none() {
        return RequestBody.builder()
                .type(RequestBodyType.NONE)
                .build();
    }

    public static RequestBody form(final List<FormField> formFields) {
        return RequestBody.builder()
                .type(RequestBodyType.FORM)
                .formFields(formFields)
                .build();
    }

    public static RequestBody raw(final String payload) {
        return RequestBody.builder()
                .type(RequestBodyType.RAW)
                .payload(payload)
                .build();
    }

    public enum RequestBodyType {
        NONE,
        FORM,
        RAW
    }
}
