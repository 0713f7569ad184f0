package dev.systest.model;

/**
 * What happened when a cleanup entry was released.
 */
public record CleanupResult(
    CleanupEntry entry,
    ErrorInfo error // null when the release succeeded
) {
    public static CleanupResult released(CleanupEntry entry) {
        return new CleanupResult(entry, null);
    }

    public static CleanupResult failed(CleanupEntry entry, ErrorInfo error) {
        return new CleanupResult(entry, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
