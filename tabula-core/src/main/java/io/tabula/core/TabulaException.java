package io.tabula.core;

public class TabulaException extends RuntimeException {

    public TabulaException(String message, Throwable cause) {
        super(message, cause);
    }

    public TabulaException(String message) {
        super(message);
    }

}
