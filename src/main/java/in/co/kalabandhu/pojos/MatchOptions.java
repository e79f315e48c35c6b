package in.co.kalabandhu.pojos;

/**
 * Per-request matching options. A null field means "use the tier default"
 * (see MatchingConfig), so an explicit 0 is honoured.
 */
public class MatchOptions {
    private Integer maxResults;
    private Double minScore;
    private Boolean enableFuzzyMatching;
    private Boolean enableSynonymMatching;
    private Boolean boostExactMatches;
    private String location;

    public MatchOptions() {}

    public static MatchOptions defaults() {
        return new MatchOptions();
    }

    public MatchOptions withMaxResults(Integer maxResults) { this.maxResults = maxResults; return this; }
    public MatchOptions withMinScore(Double minScore) { this.minScore = minScore; return this; }
    public MatchOptions withBoostExactMatches(Boolean boost) { this.boostExactMatches = boost; return this; }
    public MatchOptions withLocation(String location) { this.location = location; return this; }

    /**
     * Resolve maxResults against a tier default. Negative values count as unset.
     */
    public int maxResultsOr(int tierDefault) {
        return maxResults == null || maxResults < 0 ? tierDefault : maxResults;
    }

    public double minScoreOr(double tierDefault) {
        return minScore == null || minScore.isNaN() ? tierDefault : minScore;
    }

    public boolean isBoostExactMatches() {
        return Boolean.TRUE.equals(boostExactMatches);
    }

    // Getters and Setters
    public Integer getMaxResults() { return maxResults; }
    public void setMaxResults(Integer maxResults) { this.maxResults = maxResults; }

    public Double getMinScore() { return minScore; }
    public void setMinScore(Double minScore) { this.minScore = minScore; }

    public Boolean getEnableFuzzyMatching() { return enableFuzzyMatching; }
    public void setEnableFuzzyMatching(Boolean enableFuzzyMatching) { this.enableFuzzyMatching = enableFuzzyMatching; }

    public Boolean getEnableSynonymMatching() { return enableSynonymMatching; }
    public void setEnableSynonymMatching(Boolean enableSynonymMatching) { this.enableSynonymMatching = enableSynonymMatching; }

    public Boolean getBoostExactMatches() { return boostExactMatches; }
    public void setBoostExactMatches(Boolean boostExactMatches) { this.boostExactMatches = boostExactMatches; }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
}
