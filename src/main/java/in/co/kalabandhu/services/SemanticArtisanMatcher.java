package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.CandidateProfile;
import in.co.kalabandhu.pojos.MatchOptions;
import in.co.kalabandhu.pojos.SemanticMatchResult;

import java.util.List;

/**
 * The AI/semantic matcher used by the first matching tier.
 *
 * Current implementation: GeminiArtisanMatcher (LLM ranking over the supplied candidates)
 */
public interface SemanticArtisanMatcher {

    /**
     * Rank the candidates for the query.
     *
     * @param query      buyer text as typed
     * @param candidates profiles to rank; results must reference these objects
     * @param options    request options (maxResults is a hint)
     * @return ranked candidates with the matcher's confidence, or an error result
     * @throws Exception on transport or parsing failures; the caller falls back
     */
    SemanticMatchResult match(String query, List<CandidateProfile> candidates, MatchOptions options) throws Exception;

    /**
     * False when the matcher cannot be called at all (e.g. no API key).
     */
    boolean isConfigured();

    /**
     * Model or backend name, reported by the system status.
     */
    String getModelName();
}
