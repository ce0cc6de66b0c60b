package de.leidenheit.apicontext.core.resolving;

public interface ExpressionResolver {

    String resolveString(final String expression);
}
