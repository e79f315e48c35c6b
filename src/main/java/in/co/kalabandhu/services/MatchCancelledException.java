package in.co.kalabandhu.services;

/**
 * Thrown when the request thread is interrupted mid-match. The controller
 * turns it into an empty result and keeps the interrupt flag set.
 */
public class MatchCancelledException extends RuntimeException {

    public MatchCancelledException(int candidatesScored) {
        super("Matching cancelled after " + candidatesScored + " candidates");
    }

    public MatchCancelledException(String message) {
        super(message);
    }
}
