package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.CandidateProfile;
import in.co.kalabandhu.pojos.MatchOptions;
import in.co.kalabandhu.pojos.SemanticMatchResult;
import in.co.kalabandhu.pojos.SemanticMatchResult.SemanticMatch;

import java.util.ArrayList;
import java.util.List;

/**
 * Mock SemanticArtisanMatcher for testing the AI tier without calling Gemini.
 *
 * Usage in tests:
 *   MockSemanticArtisanMatcher ai = MockSemanticArtisanMatcher.success(0.85, 0.0, 0.9);   // candidate 1 scores 0.9
 *   MockSemanticArtisanMatcher down = MockSemanticArtisanMatcher.fail("quota exceeded");
 */
public class MockSemanticArtisanMatcher implements SemanticArtisanMatcher {

    private final boolean configured;
    private final double confidence;
    private final double[] scoresByIndex;
    private final String errorMessage;
    private final RuntimeException toThrow;
    private final long delayMs;

    private int callCount;

    private MockSemanticArtisanMatcher(boolean configured, double confidence, double[] scoresByIndex,
                                       String errorMessage, RuntimeException toThrow, long delayMs) {
        this.configured = configured;
        this.confidence = confidence;
        this.scoresByIndex = scoresByIndex;
        this.errorMessage = errorMessage;
        this.toThrow = toThrow;
        this.delayMs = delayMs;
    }

    /** Scores candidates by position; a score of 0 leaves the candidate out. */
    public static MockSemanticArtisanMatcher success(double confidence, double... scoresByIndex) {
        return new MockSemanticArtisanMatcher(true, confidence, scoresByIndex, null, null, 0L);
    }

    /** Returns a failed SemanticMatchResult. */
    public static MockSemanticArtisanMatcher fail(String errorMessage) {
        return new MockSemanticArtisanMatcher(true, 0.0, new double[0], errorMessage, null, 0L);
    }

    /** Throws from match(), as a broken client would. */
    public static MockSemanticArtisanMatcher throwing(RuntimeException e) {
        return new MockSemanticArtisanMatcher(true, 0.0, new double[0], null, e, 0L);
    }

    /** Succeeds, but only after sleeping for delayMs. */
    public static MockSemanticArtisanMatcher slow(long delayMs, double... scoresByIndex) {
        return new MockSemanticArtisanMatcher(true, 0.9, scoresByIndex, null, null, delayMs);
    }

    /** No API key: the engine must not call it. */
    public static MockSemanticArtisanMatcher unconfigured() {
        return new MockSemanticArtisanMatcher(false, 0.0, new double[0], null, null, 0L);
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public String getModelName() {
        return "mock";
    }

    @Override
    public SemanticMatchResult match(String query, List<CandidateProfile> candidates, MatchOptions options)
            throws Exception {
        callCount++;
        if (delayMs > 0) {
            Thread.sleep(delayMs);
        }
        if (toThrow != null) {
            throw toThrow;
        }
        if (errorMessage != null) {
            return SemanticMatchResult.error(errorMessage);
        }

        List<SemanticMatch> matches = new ArrayList<>();
        for (int i = 0; i < scoresByIndex.length && i < candidates.size(); i++) {
            if (scoresByIndex[i] > 0) {
                matches.add(new SemanticMatch(candidates.get(i), scoresByIndex[i], "AI pick " + i));
            }
        }
        return SemanticMatchResult.success(confidence, matches);
    }

    public int getCallCount() {
        return callCount;
    }
}
