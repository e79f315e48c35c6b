package in.co.kalabandhu.pojos;

import java.util.List;

/**
 * Input to one match run.
 */
public class MatchRequest {
    private String query;
    private List<CandidateProfile> candidates;
    private MatchOptions options;
    private boolean aiServiceHealthy;
    private SemanticMatchResult primaryMatcherResult;   // AI output computed upstream, optional
    private Long aiTimeoutMs;

    private MatchRequest() {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final MatchRequest request = new MatchRequest();

        public Builder query(String query) { request.query = query; return this; }
        public Builder candidates(List<CandidateProfile> candidates) { request.candidates = candidates; return this; }
        public Builder options(MatchOptions options) { request.options = options; return this; }
        public Builder aiServiceHealthy(boolean healthy) { request.aiServiceHealthy = healthy; return this; }
        public Builder primaryMatcherResult(SemanticMatchResult result) { request.primaryMatcherResult = result; return this; }
        public Builder aiTimeoutMs(Long timeoutMs) { request.aiTimeoutMs = timeoutMs; return this; }

        public MatchRequest build() { return request; }
    }

    public String getQuery() {
        return query == null ? "" : query;
    }

    /**
     * Candidates as supplied; never null.
     */
    public List<CandidateProfile> getCandidates() {
        return candidates == null ? List.of() : candidates;
    }

    public MatchOptions getOptions() {
        return options == null ? MatchOptions.defaults() : options;
    }

    public boolean isAiServiceHealthy() { return aiServiceHealthy; }
    public SemanticMatchResult getPrimaryMatcherResult() { return primaryMatcherResult; }
    public Long getAiTimeoutMs() { return aiTimeoutMs; }
}
