package fr.lapetina.watchman.domain.exception;

/**
 * Raised by status queries for a name that is not registered, or that has no status yet.
 * Surfaced to HTTP callers as 404.
 */
public final class TargetNotFoundException extends RuntimeException {

    private final String targetName;

    public TargetNotFoundException(String targetName) {
        super("Target not found: " + targetName);
        this.targetName = targetName;
    }

    public TargetNotFoundException(String targetName, String message) {
        super(message);
        this.targetName = targetName;
    }

    public String getTargetName() {
        return targetName;
    }
}
