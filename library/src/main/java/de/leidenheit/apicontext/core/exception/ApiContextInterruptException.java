package de.leidenheit.apicontext.core.exception;

public class ApiContextInterruptException extends RuntimeException {

    public ApiContextInterruptException() {
        super();
    }

    public ApiContextInterruptException(final String message) {
        super(message);
    }

    public ApiContextInterruptException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ApiContextInterruptException(final Throwable cause) {
        super(cause);
    }
}
