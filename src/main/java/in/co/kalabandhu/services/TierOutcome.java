package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.MatchRunResult;

/**
 * What a matching strategy reports back to the routing controller.
 */
public class TierOutcome {

    public enum Kind {
        OK,             // terminal: use the result
        FALLTHROUGH,    // expected degradation: try the next tier
        FATAL           // unexpected failure: log it, then try the next tier
    }

    public final Kind kind;
    public final MatchRunResult result;
    public final String reason;
    public final Throwable error;

    private TierOutcome(Kind kind, MatchRunResult result, String reason, Throwable error) {
        this.kind = kind;
        this.result = result;
        this.reason = reason;
        this.error = error;
    }

    public static TierOutcome ok(MatchRunResult result) {
        return new TierOutcome(Kind.OK, result, null, null);
    }

    public static TierOutcome fallthrough(String reason) {
        return new TierOutcome(Kind.FALLTHROUGH, null, reason, null);
    }

    public static TierOutcome fatal(Throwable error) {
        return new TierOutcome(Kind.FATAL, null, error.getMessage(), error);
    }
}
