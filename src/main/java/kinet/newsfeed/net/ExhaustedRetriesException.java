package kinet.newsfeed.net;

public class ExhaustedRetriesException extends Exception {
    private final int attempts;

    public ExhaustedRetriesException(int attempts, Throwable lastFailure) {
        super(lastFailure == null ? "Gave up after " + attempts + " attempt(s)"
                : lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() { return attempts; }
}
