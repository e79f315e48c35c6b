package in.co.kalabandhu.pojos;

import java.util.List;

/**
 * JSON body of a Lambda invocation, parsed with Gson.
 */
public class MatchRequestBody {
    private String function;        // match_artisans, analyze_query, fallback_capabilities, match_feedback, system_status
    private String query;
    private List<CandidateProfile> candidates;
    private MatchOptions options;
    private Boolean aiServiceHealthy;
    private Long aiTimeoutMs;
    private CandidateProfile selectedCandidate;
    private String feedback;        // positive, negative

    public MatchRequestBody() {}

    public String getFunction() { return function; }
    public void setFunction(String function) { this.function = function; }

    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }

    public List<CandidateProfile> getCandidates() { return candidates; }
    public void setCandidates(List<CandidateProfile> candidates) { this.candidates = candidates; }

    public MatchOptions getOptions() { return options; }
    public void setOptions(MatchOptions options) { this.options = options; }

    public Boolean getAiServiceHealthy() { return aiServiceHealthy; }
    public void setAiServiceHealthy(Boolean aiServiceHealthy) { this.aiServiceHealthy = aiServiceHealthy; }

    public Long getAiTimeoutMs() { return aiTimeoutMs; }
    public void setAiTimeoutMs(Long aiTimeoutMs) { this.aiTimeoutMs = aiTimeoutMs; }

    public CandidateProfile getSelectedCandidate() { return selectedCandidate; }
    public void setSelectedCandidate(CandidateProfile selectedCandidate) { this.selectedCandidate = selectedCandidate; }

    public String getFeedback() { return feedback; }
    public void setFeedback(String feedback) { this.feedback = feedback; }

    public MatchRequest toMatchRequest() {
        return MatchRequest.builder()
                .query(query)
                .candidates(candidates)
                .options(options)
                .aiServiceHealthy(Boolean.TRUE.equals(aiServiceHealthy))
                .aiTimeoutMs(aiTimeoutMs)
                .build();
    }
}
