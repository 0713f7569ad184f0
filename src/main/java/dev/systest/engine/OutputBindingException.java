package dev.systest.engine;

/**
 * A step result could not be folded into the context as its output spec demands.
 */
public class OutputBindingException extends RuntimeException {

    public OutputBindingException(String message) {
        super(message);
    }
}
