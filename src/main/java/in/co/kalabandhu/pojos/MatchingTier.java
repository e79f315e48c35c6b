package in.co.kalabandhu.pojos;

/**
 * The matching strategies, in the order the routing controller tries them.
 */
public enum MatchingTier {
    AI,
    DETERMINISTIC,
    EMERGENCY,
    NONE    // short-circuited before any tier ran (short query, no candidates, cancelled)
}
