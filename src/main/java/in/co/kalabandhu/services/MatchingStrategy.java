package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.MatchRequest;
import in.co.kalabandhu.pojos.MatchingTier;

/**
 * One tier of the matching cascade.
 */
public interface MatchingStrategy {

    MatchingTier tier();

    /**
     * Try to answer the request. Implementations report failure through the
     * outcome; the controller also converts anything thrown into FATAL,
     * except MatchCancelledException which ends the run.
     */
    TierOutcome attempt(MatchRequest request);
}
