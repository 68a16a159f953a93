package io.stew.core;

public class StewException extends RuntimeException {

    public StewException(Throwable cause) {
        super(cause);
    }

    public StewException(String message, Throwable cause) {
        super(message, cause);
    }

    public StewException(String message) {
        super(message);
    }

}
