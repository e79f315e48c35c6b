package in.co.kalabandhu.pojos;

/**
 * Per-run diagnostics attached to a MatchRunResult.
 */
public class MatchAnalytics {
    private String queryComplexity;         // simple, moderate, complex
    private double professionConfidence;
    private int totalCandidatesEvaluated;
    private double averageRelevanceScore;

    public MatchAnalytics() {}

    public MatchAnalytics(String queryComplexity, double professionConfidence,
                          int totalCandidatesEvaluated, double averageRelevanceScore) {
        this.queryComplexity = queryComplexity;
        this.professionConfidence = professionConfidence;
        this.totalCandidatesEvaluated = totalCandidatesEvaluated;
        this.averageRelevanceScore = averageRelevanceScore;
    }

    public String getQueryComplexity() { return queryComplexity; }
    public void setQueryComplexity(String queryComplexity) { this.queryComplexity = queryComplexity; }

    public double getProfessionConfidence() { return professionConfidence; }
    public void setProfessionConfidence(double professionConfidence) { this.professionConfidence = professionConfidence; }

    public int getTotalCandidatesEvaluated() { return totalCandidatesEvaluated; }
    public void setTotalCandidatesEvaluated(int totalCandidatesEvaluated) { this.totalCandidatesEvaluated = totalCandidatesEvaluated; }

    public double getAverageRelevanceScore() { return averageRelevanceScore; }
    public void setAverageRelevanceScore(double averageRelevanceScore) { this.averageRelevanceScore = averageRelevanceScore; }
}
