package relay.resolve;

/**
 * Thrown when a source's external identity cannot be determined. The affected source is
 * skipped for the current cycle; other sources are unaffected.
 */
public final class SourceResolutionException extends RuntimeException {

    public SourceResolutionException(String message) {
        super(message);
    }

    public SourceResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
