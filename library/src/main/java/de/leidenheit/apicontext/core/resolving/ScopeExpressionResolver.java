package de.leidenheit.apicontext.core.resolving;

import com.google.common.base.Strings;
import de.leidenheit.apicontext.core.context.VariableScope;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces a scope reference written as {@code `##key`} with the value stored under {@code key}.
 * <p>
 * Only the first reference of a string is replaced; any further references are left as they are.
 * A reference to an unset key resolves to the empty string.
 */
public class ScopeExpressionResolver implements ExpressionResolver {

    private static final Pattern SCOPE_REFERENCE = Pattern.compile("`##(.*?)`");

    private final VariableScope scope;

    public ScopeExpressionResolver(final VariableScope scope) {
        this.scope = scope;
    }

    @Override
    public String resolveString(final String expression) {
        if (Objects.isNull(expression)) return null;

        Matcher matcher = SCOPE_REFERENCE.matcher(expression);
        if (!matcher.find() || Strings.isNullOrEmpty(matcher.group(1))) {
            return expression;
        }
        var resolved = Strings.nullToEmpty(scope.get(matcher.group(1)));
        return expression.substring(0, matcher.start()) + resolved + expression.substring(matcher.end());
    }
}
