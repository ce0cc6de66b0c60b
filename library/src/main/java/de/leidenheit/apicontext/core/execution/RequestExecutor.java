package de.leidenheit.apicontext.core.execution;

import de.leidenheit.apicontext.core.execution.context.ExecutionResult;
import de.leidenheit.apicontext.core.model.RequestDefinition;

public interface RequestExecutor {

    ExecutionResult execute(final RequestDefinition requestDefinition);
}
