package io.roarindex.core;

public class RoarIndexException extends RuntimeException {

    public RoarIndexException(Throwable cause) {
        super(cause);
    }

    public RoarIndexException(String message, Throwable cause) {
        super(message, cause);
    }

    public RoarIndexException(String message) {
        super(message);
    }

}
