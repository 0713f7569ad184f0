package dev.systest.model;

/**
 * A single assertion recorded while a step procedure ran.
 */
public record AssertionEvent(
    Type type,
    Object expected, // nullable
    Object actual,   // nullable
    String message
) {
    public enum Type { PASS, FAIL }

    public static AssertionEvent pass(Object expected, Object actual, String message) {
        return new AssertionEvent(Type.PASS, expected, actual, message);
    }

    public static AssertionEvent fail(Object expected, Object actual, String message) {
        return new AssertionEvent(Type.FAIL, expected, actual, message);
    }

    public boolean passed() {
        return type == Type.PASS;
    }
}
