package chaptercrawler;

// A page could not be fetched or had no chapter in it. Only the chain through this page stops.
public class FetchException extends Exception {
    private final FailureType type;

    public FetchException(FailureType type, String message) {
        super(message);
        this.type = type;
    }

    public FetchException(FailureType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public FailureType type() {
        return type;
    }
}
