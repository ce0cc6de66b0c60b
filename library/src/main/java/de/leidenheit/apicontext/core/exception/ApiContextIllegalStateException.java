package de.leidenheit.apicontext.core.exception;

public class ApiContextIllegalStateException extends RuntimeException {

    public ApiContextIllegalStateException() {
        super();
    }

    public ApiContextIllegalStateException(final String message) {
        super(message);
    }

    public ApiContextIllegalStateException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ApiContextIllegalStateException(final Throwable cause) {
        super(cause);
    }
}
