package de.leidenheit.apicontext.core.exception;

public class ApiContextResourceException extends RuntimeException {

    public ApiContextResourceException() {
        super();
    }

    public ApiContextResourceException(final String message) {
        super(message);
    }

    public ApiContextResourceException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ApiContextResourceException(final Throwable cause) {
        super(cause);
    }
}
