package dev.systest.model;

import java.util.HashSet;
import java.util.Set;

/**
 * Where a step or test was declared.
 */
public record SourceLocation(
    String className,
    String fileName, // nullable
    int line
) {
    public static final SourceLocation UNKNOWN = new SourceLocation("unknown", null, -1);

    private static final StackWalker WALKER = StackWalker.getInstance();

    /**
     * Location of the first caller outside this class and the given builder classes.
     */
    public static SourceLocation capture(Class<?>... skipped) {
        Set<String> skip = new HashSet<>();
        skip.add(SourceLocation.class.getName());
        for (Class<?> c : skipped) {
            skip.add(c.getName());
        }
        return WALKER.walk(frames -> frames
            .filter(f -> !skip.contains(f.getClassName()))
            .findFirst()
            .map(f -> new SourceLocation(f.getClassName(), f.getFileName(), f.getLineNumber()))
            .orElse(UNKNOWN));
    }

    @Override
    public String toString() {
        return (fileName != null ? fileName : className) + ":" + line;
    }
}
