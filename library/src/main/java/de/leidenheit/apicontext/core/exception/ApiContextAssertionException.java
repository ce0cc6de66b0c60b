package de.leidenheit.apicontext.core.exception;

/**
 * Well-formed data that does not meet an expectation. Extends {@link AssertionError} so test
 * runners report it as a failed assertion rather than an error.
 */
public class ApiContextAssertionException extends AssertionError {

    public ApiContextAssertionException() {
        super();
    }

    public ApiContextAssertionException(final String message) {
        super(message);
    }

    public ApiContextAssertionException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ApiContextAssertionException(final Throwable cause) {
        super(cause);
    }
}
