package de.leidenheit.apicontext.core.exception;

public class ApiContextUnsupportedException extends RuntimeException {

    public ApiContextUnsupportedException() {
        super();
    }

    public ApiContextUnsupportedException(final String message) {
        super(message);
    }

    public ApiContextUnsupportedException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ApiContextUnsupportedException(final Throwable cause) {
        super(cause);
    }
}
