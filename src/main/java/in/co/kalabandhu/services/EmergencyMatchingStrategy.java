package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.MatchRequest;
import in.co.kalabandhu.pojos.MatchRunResult;
import in.co.kalabandhu.pojos.MatchingTier;
import in.co.kalabandhu.pojos.QueryAnalysis;

/**
 * Tier 3: plain text matching. Always answers, with an empty result if even
 * the emergency scorer fails.
 */
public class EmergencyMatchingStrategy implements MatchingStrategy {

    private final EmergencyScorer scorer;

    public EmergencyMatchingStrategy(EmergencyScorer scorer) {
        this.scorer = scorer;
    }

    @Override
    public MatchingTier tier() {
        return MatchingTier.EMERGENCY;
    }

    @Override
    public TierOutcome attempt(MatchRequest request) {
        long start = System.currentTimeMillis();
        try {
            return TierOutcome.ok(scorer.match(request.getQuery(), request.getCandidates(),
                    request.getOptions(), start));
        } catch (RuntimeException e) {
            LoggingService.error("emergency_scorer_failed", e);
            return TierOutcome.ok(new MatchRunResult(null, QueryAnalysis.empty(request.getQuery()),
                    System.currentTimeMillis() - start, MatchingConfig.EMERGENCY_CONFIDENCE, true,
                    MatchingTier.EMERGENCY));
        }
    }
}
