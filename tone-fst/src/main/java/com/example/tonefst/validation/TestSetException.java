package com.example.tonefst.validation;

/**
 * Raised when a test set file cannot be interpreted.
 */
public class TestSetException extends RuntimeException {

    public TestSetException(String message) {
        super(message);
    }

    public TestSetException(String message, Throwable cause) {
        super(message, cause);
    }
}
