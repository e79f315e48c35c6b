package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.CandidateProfile;
import in.co.kalabandhu.pojos.MatchExplanation;
import in.co.kalabandhu.pojos.MatchField;
import in.co.kalabandhu.pojos.MatchOptions;
import in.co.kalabandhu.pojos.MatchRequest;
import in.co.kalabandhu.pojos.MatchResult;
import in.co.kalabandhu.pojos.MatchingTier;
import in.co.kalabandhu.pojos.QueryAnalysis;
import in.co.kalabandhu.pojos.SemanticMatchResult;
import in.co.kalabandhu.pojos.SemanticMatchResult.SemanticMatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tier 1: use the AI matcher's ranking.
 *
 * A result computed upstream (MatchRequest.primaryMatcherResult) is used as
 * is; otherwise the matcher is called on the executor and waited for at
 * most the request timeout. Timeouts, errors, a saturated executor and
 * failed results fall through to the deterministic tier.
 *
 * The deterministic signals are still computed for the AI's picks so the
 * match flags and score breakdown stay meaningful.
 */
public class AiMatchingStrategy implements MatchingStrategy {

    public static final String DEFAULT_AI_REASON = "AI semantic match";

    private final SemanticArtisanMatcher matcher;
    private final ExecutorService executor;
    private final QueryAnalyzer analyzer;
    private final CandidateScorer scorer;
    private final ExplanationBuilder explanationBuilder;
    private final ResultAssembler assembler;

    public AiMatchingStrategy(SemanticArtisanMatcher matcher, ExecutorService executor, QueryAnalyzer analyzer,
                              CandidateScorer scorer, ExplanationBuilder explanationBuilder,
                              ResultAssembler assembler) {
        this.matcher = matcher;
        this.executor = executor;
        this.analyzer = analyzer;
        this.scorer = scorer;
        this.explanationBuilder = explanationBuilder;
        this.assembler = assembler;
    }

    @Override
    public MatchingTier tier() {
        return MatchingTier.AI;
    }

    @Override
    public TierOutcome attempt(MatchRequest request) {
        long start = System.currentTimeMillis();

        SemanticMatchResult semantic = request.getPrimaryMatcherResult();
        if (semantic == null) {
            if (matcher == null || !matcher.isConfigured()) {
                return TierOutcome.fallthrough("ai_matcher_not_configured");
            }
            try {
                semantic = callWithTimeout(request);
            } catch (TimeoutException e) {
                return TierOutcome.fallthrough("ai_matcher_timeout");
            } catch (RejectedExecutionException e) {
                LoggingService.warn("ai_matcher_saturated");
                return TierOutcome.fallthrough("ai_matcher_saturated");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LoggingService.warn("ai_matcher_call_failed", LoggingService.data(
                        "error", cause.getClass().getSimpleName() + ": " + cause.getMessage()));
                return TierOutcome.fallthrough("ai_matcher_error");
            }
        }
        if (semantic == null || !semantic.success) {
            return TierOutcome.fallthrough(semantic == null ? "ai_matcher_no_result" : semantic.errorMessage);
        }

        MatchOptions options = request.getOptions();
        QueryAnalysis analysis = analyzer.analyze(request.getQuery(),
                !Boolean.FALSE.equals(options.getEnableSynonymMatching()));

        // A candidate listed more than once keeps its first entry
        List<SemanticMatch> picks = new ArrayList<>();
        Set<CandidateProfile> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (SemanticMatch match : semantic.matches) {
            if (match != null && match.candidate != null && seen.add(match.candidate)) {
                picks.add(match);
            }
        }

        List<MatchResult> matches = assembler.assemble(picks, m -> clamp(m.score),
                m -> toMatchResult(m, analysis, options),
                options.minScoreOr(MatchingConfig.AI_DEFAULT_MIN_SCORE),
                options.maxResultsOr(MatchingConfig.AI_DEFAULT_MAX_RESULTS));

        return TierOutcome.ok(assembler.toRunResult(matches, analysis, start,
                clamp(semantic.confidence), false, MatchingTier.AI));
    }

    private SemanticMatchResult callWithTimeout(MatchRequest request) throws TimeoutException, ExecutionException {
        long timeoutMs = request.getAiTimeoutMs() == null || request.getAiTimeoutMs() <= 0
                ? MatchingConfig.DEFAULT_AI_TIMEOUT_MS
                : request.getAiTimeoutMs();

        Future<SemanticMatchResult> future = executor.submit(
                () -> matcher.match(request.getQuery(), request.getCandidates(), request.getOptions()));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LoggingService.warn("ai_matcher_timeout", LoggingService.data("timeoutMs", timeoutMs));
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new MatchCancelledException("Interrupted while waiting for the AI matcher");
        }
    }

    private MatchResult toMatchResult(SemanticMatch match, QueryAnalysis analysis, MatchOptions options) {
        CandidateProfile candidate = match.candidate;
        ScoredCandidate signals = scorer.score(candidate, 0, analysis, options);
        double score = clamp(match.score);
        MatchExplanation keywordExplanation = explanationBuilder.build(signals.matches, score);

        String aiReason = match.reason == null || match.reason.isBlank() ? DEFAULT_AI_REASON : match.reason.trim();
        List<String> reasons = new ArrayList<>();
        reasons.add(aiReason);
        for (String reason : keywordExplanation.getDetailedReasons()) {
            if (reasons.size() >= MatchingConfig.MAX_DETAILED_REASONS) {
                break;
            }
            reasons.add(reason);
        }

        MatchExplanation explanation = new MatchExplanation(aiReason, reasons,
                keywordExplanation.getMatchedSkills(), keywordExplanation.getMatchedMaterials(),
                keywordExplanation.getMatchedTechniques(), ExplanationBuilder.confidenceLevelFor(score),
                keywordExplanation.getScoreBreakdown());

        return new MatchResult(candidate, score,
                signals.hasMatchOn(MatchField.PROFESSION),
                signals.hasMatchOn(MatchField.MATERIAL),
                signals.hasMatchOn(MatchField.TECHNIQUE),
                signals.hasMatchOn(MatchField.SPECIALIZATION),
                CandidateScorer.locationMatches(candidate, options.getLocation()),
                explanation);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
