package de.leidenheit.apicontext.core.exception;

public class ApiContextTransportException extends RuntimeException {

    public ApiContextTransportException() {
        super();
    }

    public ApiContextTransportException(final String message) {
        super(message);
    }

    public ApiContextTransportException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ApiContextTransportException(final Throwable cause) {
        super(cause);
    }
}
