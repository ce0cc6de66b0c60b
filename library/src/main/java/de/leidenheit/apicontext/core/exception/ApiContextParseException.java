package de.leidenheit.apicontext.core.exception;

public class ApiContextParseException extends RuntimeException {

    public ApiContextParseException() {
        super();
    }

    public ApiContextParseException(final String message) {
        super(message);
    }

    public ApiContextParseException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ApiContextParseException(final Throwable cause) {
        super(cause);
    }
}
