package dev.systest.model;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Report-friendly capture of a throwable.
 */
public record ErrorInfo(
    String type,
    String message, // nullable
    String stackTrace
) {
    public static ErrorInfo from(Throwable t) {
        var out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return new ErrorInfo(t.getClass().getName(), t.getMessage(), out.toString());
    }

    public String summary() {
        return message == null ? type : type + ": " + message;
    }
}
