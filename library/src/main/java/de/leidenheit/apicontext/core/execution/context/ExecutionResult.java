package de.leidenheit.apicontext.core.execution.context;

import de.leidenheit.apicontext.core.model.CapturedRequest;
import de.leidenheit.apicontext.core.model.CapturedResponse;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExecutionResult {

    final CapturedRequest request;
    final CapturedResponse response;
}
