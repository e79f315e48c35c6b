package in.co.kalabandhu.pojos;

import java.util.List;

/**
 * Everything a match run returns to the caller. Always populated.
 */
public class MatchRunResult {
    private final List<MatchResult> matches;
    private final int totalFound;
    private final QueryAnalysis queryAnalysis;
    private final long processingTimeMs;
    private final double confidence;
    private final boolean fallbackUsed;
    private final MatchingTier tierUsed;
    private MatchAnalytics analytics;

    public MatchRunResult(List<MatchResult> matches, QueryAnalysis queryAnalysis, long processingTimeMs,
                          double confidence, boolean fallbackUsed, MatchingTier tierUsed) {
        this.matches = matches == null ? List.of() : List.copyOf(matches);
        this.totalFound = this.matches.size();
        this.queryAnalysis = queryAnalysis;
        this.processingTimeMs = Math.max(0L, processingTimeMs);
        this.confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        this.fallbackUsed = fallbackUsed;
        this.tierUsed = tierUsed;
    }

    /**
     * A successful run with no matches.
     */
    public static MatchRunResult empty(QueryAnalysis queryAnalysis, long processingTimeMs, boolean fallbackUsed) {
        return new MatchRunResult(List.of(), queryAnalysis, processingTimeMs,
                queryAnalysis == null ? 0.0 : queryAnalysis.getConfidence(), fallbackUsed, MatchingTier.NONE);
    }

    public List<MatchResult> getMatches() { return matches; }
    public int getTotalFound() { return totalFound; }
    public QueryAnalysis getQueryAnalysis() { return queryAnalysis; }
    public long getProcessingTimeMs() { return processingTimeMs; }
    public double getConfidence() { return confidence; }
    public boolean isFallbackUsed() { return fallbackUsed; }
    public MatchingTier getTierUsed() { return tierUsed; }

    public MatchAnalytics getAnalytics() { return analytics; }
    public void setAnalytics(MatchAnalytics analytics) { this.analytics = analytics; }
}
