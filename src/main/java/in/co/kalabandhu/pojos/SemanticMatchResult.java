package in.co.kalabandhu.pojos;

import java.util.List;

/**
 * Output of the AI/semantic matcher: ranked candidates plus the matcher's
 * own confidence, or a failure message.
 */
public class SemanticMatchResult {
    public final boolean success;
    public final double confidence;
    public final List<SemanticMatch> matches;
    public final String errorMessage;

    /**
     * One candidate as ranked by the AI matcher.
     */
    public static class SemanticMatch {
        public final CandidateProfile candidate;
        public final double score;
        public final String reason;

        public SemanticMatch(CandidateProfile candidate, double score, String reason) {
            this.candidate = candidate;
            this.score = score;
            this.reason = reason;
        }
    }

    private SemanticMatchResult(boolean success, double confidence, List<SemanticMatch> matches, String errorMessage) {
        this.success = success;
        this.confidence = confidence;
        this.matches = matches == null ? List.of() : List.copyOf(matches);
        this.errorMessage = errorMessage;
    }

    public static SemanticMatchResult success(double confidence, List<SemanticMatch> matches) {
        return new SemanticMatchResult(true, confidence, matches, null);
    }

    public static SemanticMatchResult error(String message) {
        return new SemanticMatchResult(false, 0.0, List.of(), message);
    }
}
