package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.MatchResult;
import in.co.kalabandhu.pojos.MatchRunResult;
import in.co.kalabandhu.pojos.MatchingTier;
import in.co.kalabandhu.pojos.QueryAnalysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Filter, rank and package scored items. Shared by every tier.
 *
 * Ties keep the order the items were supplied in (List.sort is stable), so
 * two equally scored artisans come back in the caller's order.
 */
public class ResultAssembler {

    /**
     * @param items      scored items in original candidate order
     * @param scoreOf    score of an item, already clamped to [0,1]
     * @param toResult   builds the MatchResult for an item that survives filtering
     * @param minScore   items scoring below this are dropped
     * @param maxResults upper bound on the returned list
     * @return matches with rank 1..N in descending score order
     */
    public <T> List<MatchResult> assemble(List<T> items, ToDoubleFunction<T> scoreOf,
                                          Function<T, MatchResult> toResult,
                                          double minScore, int maxResults) {
        List<T> kept = new ArrayList<>();
        for (T item : items) {
            if (scoreOf.applyAsDouble(item) >= minScore) {
                kept.add(item);
            }
        }
        kept.sort(Comparator.comparingDouble(scoreOf).reversed());

        int limit = Math.max(0, Math.min(kept.size(), maxResults));
        List<MatchResult> ranked = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            MatchResult result = toResult.apply(kept.get(i));
            result.setRank(i + 1);
            ranked.add(result);
        }
        return ranked;
    }

    public MatchRunResult toRunResult(List<MatchResult> matches, QueryAnalysis analysis, long tierStartMillis,
                                      double confidence, boolean fallbackUsed, MatchingTier tier) {
        long processingTime = System.currentTimeMillis() - tierStartMillis;
        return new MatchRunResult(matches, analysis, processingTime, confidence, fallbackUsed, tier);
    }
}
