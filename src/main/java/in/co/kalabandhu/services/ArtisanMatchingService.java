package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.CandidateProfile;
import in.co.kalabandhu.pojos.ExtractionMethod;
import in.co.kalabandhu.pojos.FallbackCapabilities;
import in.co.kalabandhu.pojos.MatchAnalytics;
import in.co.kalabandhu.pojos.MatchFeedback;
import in.co.kalabandhu.pojos.MatchOptions;
import in.co.kalabandhu.pojos.MatchRequest;
import in.co.kalabandhu.pojos.MatchResult;
import in.co.kalabandhu.pojos.MatchRunResult;
import in.co.kalabandhu.pojos.MatchingTier;
import in.co.kalabandhu.pojos.QueryAnalysis;
import in.co.kalabandhu.pojos.SystemStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the artisan matching engine.
 *
 * Routes each request through the tier chain AI -> deterministic ->
 * emergency and returns the first successful result. The contract is total:
 * for any query, candidate list, options and health flag a MatchRunResult
 * comes back and no exception escapes matchArtisans.
 *
 * Create one instance at startup and share it; it holds no per-request
 * state. close() stops the executor used for AI calls.
 */
public class ArtisanMatchingService implements AutoCloseable {

    private final SynonymTables tables;
    private final QueryAnalyzer analyzer;
    private final SemanticArtisanMatcher aiMatcher;
    private final List<MatchingStrategy> strategies;
    private final ThreadPoolExecutor aiExecutor;

    /**
     * Default wiring: bundled synonym tables and the Gemini matcher.
     */
    public static ArtisanMatchingService createDefault() {
        return new ArtisanMatchingService(SynonymTablesLoader.loadDefault(), new GeminiArtisanMatcher());
    }

    public ArtisanMatchingService(SynonymTables tables, SemanticArtisanMatcher aiMatcher) {
        this(tables, aiMatcher, new CandidateScorer(tables));
    }

    /**
     * Wiring with a caller-provided scorer, used to exercise tier degradation.
     */
    public ArtisanMatchingService(SynonymTables tables, SemanticArtisanMatcher aiMatcher, CandidateScorer scorer) {
        this.tables = tables;
        this.analyzer = new QueryAnalyzer(tables);
        this.aiMatcher = aiMatcher;
        this.aiExecutor = newAiExecutor();

        ResultAssembler assembler = new ResultAssembler();
        ExplanationBuilder explanationBuilder = new ExplanationBuilder();

        List<MatchingStrategy> chain = new ArrayList<>();
        chain.add(new AiMatchingStrategy(aiMatcher, aiExecutor, analyzer, scorer, explanationBuilder, assembler));
        chain.add(new DeterministicMatchingStrategy(analyzer, scorer, explanationBuilder, assembler));
        chain.add(new EmergencyMatchingStrategy(new EmergencyScorer(assembler)));
        this.strategies = List.copyOf(chain);
    }

    /**
     * Match artisans for a buyer query. Never throws.
     */
    public MatchRunResult matchArtisans(MatchRequest request) {
        long start = System.currentTimeMillis();
        LoggingService.setSearchId("search_" + UUID.randomUUID());

        try {
            if (request == null) {
                return withAnalytics(MatchRunResult.empty(QueryAnalysis.empty(""), 0L, true), 0);
            }

            int candidateCount = request.getCandidates().size();
            String normalized = QueryAnalyzer.normalize(request.getQuery());
            if (normalized.length() < MatchingConfig.MIN_QUERY_LENGTH) {
                LoggingService.info("artisan_match_query_too_short", LoggingService.data("length", normalized.length()));
                return withAnalytics(MatchRunResult.empty(QueryAnalysis.empty(request.getQuery()),
                        System.currentTimeMillis() - start, true), candidateCount);
            }
            if (candidateCount == 0) {
                LoggingService.info("artisan_match_no_candidates");
                return withAnalytics(MatchRunResult.empty(analyzer.analyze(request.getQuery()),
                        System.currentTimeMillis() - start, true), 0);
            }

            LoggingService.logOperationStart("artisan_match", LoggingService.data(
                    "candidates", candidateCount,
                    "aiServiceHealthy", request.isAiServiceHealthy(),
                    "precomputedAi", request.getPrimaryMatcherResult() != null));

            MatchRunResult result = runChain(request);
            if (result == null) {
                LoggingService.error("artisan_match_chain_exhausted", LoggingService.data("candidates", candidateCount));
                result = MatchRunResult.empty(analyzer.analyze(request.getQuery()),
                        System.currentTimeMillis() - start, true);
            }

            LoggingService.logOperationEnd("artisan_match", start, LoggingService.data(
                    "tier", result.getTierUsed().name(),
                    "totalFound", result.getTotalFound(),
                    "confidence", result.getConfidence(),
                    "fallbackUsed", result.isFallbackUsed()));
            return withAnalytics(result, candidateCount);

        } catch (MatchCancelledException e) {
            Thread.currentThread().interrupt();
            LoggingService.warn("artisan_match_cancelled", LoggingService.data("reason", e.getMessage()));
            return withAnalytics(MatchRunResult.empty(QueryAnalysis.empty(request.getQuery()),
                    System.currentTimeMillis() - start, true), request.getCandidates().size());
        } catch (RuntimeException e) {
            // Only reachable if the chain bookkeeping itself breaks
            LoggingService.logOperationFailed("artisan_match", start, e);
            return MatchRunResult.empty(QueryAnalysis.empty(request == null ? "" : request.getQuery()),
                    System.currentTimeMillis() - start, true);
        } finally {
            LoggingService.setTier(null);
        }
    }

    private MatchRunResult runChain(MatchRequest request) {
        for (MatchingStrategy strategy : strategies) {
            String tierName = strategy.tier().name();
            LoggingService.setTier(tierName);

            if (strategy.tier() == MatchingTier.AI
                    && shouldUseFallback(request.isAiServiceHealthy(), false)) {
                LoggingService.info("ai_tier_skipped", LoggingService.data("reason", "ai_unavailable"));
                continue;
            }

            TierOutcome outcome;
            try {
                outcome = strategy.attempt(request);
            } catch (MatchCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                outcome = TierOutcome.fatal(e);
            }

            switch (outcome.kind) {
                case OK:
                    return outcome.result;
                case FALLTHROUGH:
                    LoggingService.warn("tier_fallthrough", LoggingService.data(
                            "tier", tierName, "reason", outcome.reason));
                    break;
                case FATAL:
                default:
                    LoggingService.error("tier_failed", outcome.error, LoggingService.data(
                            "tier", tierName, "reason", outcome.reason));
                    break;
            }
        }
        return null;
    }

    /**
     * Decide whether to skip the AI tier. Currently the negation of the health
     * flag reported by the AI service's circuit breaker; forceCheck is accepted
     * for callers that want a fresh check and does not change the answer yet.
     */
    public boolean shouldUseFallback(boolean aiServiceHealthy, boolean forceCheck) {
        if (forceCheck) {
            // TODO: query SemanticArtisanMatcher directly once it exposes a health endpoint
            return !aiServiceHealthy;
        }
        return !aiServiceHealthy;
    }

    /**
     * Ranked matches only, capped at maxResults. The AI tier is tried when
     * the matcher is configured.
     */
    public List<MatchResult> quickMatch(String query, List<CandidateProfile> candidates, int maxResults) {
        MatchRequest request = MatchRequest.builder()
                .query(query)
                .candidates(candidates)
                .options(MatchOptions.defaults().withMaxResults(maxResults))
                .aiServiceHealthy(aiMatcher != null && aiMatcher.isConfigured())
                .build();
        return matchArtisans(request).getMatches();
    }

    public List<MatchResult> quickMatch(String query, List<CandidateProfile> candidates) {
        return quickMatch(query, candidates, MatchingConfig.QUICK_MATCH_DEFAULT_MAX_RESULTS);
    }

    /**
     * Configuration snapshot for diagnostics. AI availability is the
     * matcher's configuration state; no call is made to the AI backend.
     */
    public SystemStatus getSystemStatus() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("aiMinScore", MatchingConfig.AI_DEFAULT_MIN_SCORE);
        defaults.put("aiMaxResults", MatchingConfig.AI_DEFAULT_MAX_RESULTS);
        defaults.put("aiTimeoutMs", MatchingConfig.DEFAULT_AI_TIMEOUT_MS);
        defaults.put("deterministicMinScore", MatchingConfig.DETERMINISTIC_DEFAULT_MIN_SCORE);
        defaults.put("deterministicMaxResults", MatchingConfig.DETERMINISTIC_DEFAULT_MAX_RESULTS);
        defaults.put("emergencyMinScore", MatchingConfig.EMERGENCY_DEFAULT_MIN_SCORE);
        defaults.put("emergencyMaxResults", MatchingConfig.EMERGENCY_DEFAULT_MAX_RESULTS);
        defaults.put("aiMaxConcurrentCalls", MatchingConfig.AI_MAX_CONCURRENT_CALLS);

        return new SystemStatus(
                aiMatcher != null && aiMatcher.isConfigured(),
                aiMatcher == null ? null : aiMatcher.getModelName(),
                aiExecutor.getActiveCount(),
                new ArrayList<>(tables.getProfessions().keySet()),
                tables.getVersion(),
                defaults);
    }

    /**
     * Analysis only, without scoring any candidates.
     */
    public QueryAnalysis analyzeQuery(String query) {
        return analyzer.analyze(query);
    }

    public FallbackCapabilities getFallbackCapabilities() {
        List<String> methods = new ArrayList<>();
        for (ExtractionMethod method : ExtractionMethod.values()) {
            methods.add(method.getValue());
        }
        return new FallbackCapabilities(
                new ArrayList<>(tables.getProfessions().keySet()),
                new ArrayList<>(tables.getMaterials().keySet()),
                new ArrayList<>(tables.getTechniques().keySet()),
                methods,
                MatchingConfig.FALLBACK_CAPABILITY_CONFIDENCE,
                tables.getVersion());
    }

    /**
     * Record buyer feedback on a match. Logged only; nothing here may change
     * how later requests are scored.
     */
    public void learnFromSuccessfulMatches(String query, CandidateProfile selectedCandidate, MatchFeedback feedback) {
        LoggingService.info("match_learning_opportunity", LoggingService.data(
                "query", query,
                "candidateId", selectedCandidate == null ? null : selectedCandidate.getId(),
                "feedback", feedback == null ? null : feedback.name().toLowerCase(Locale.ROOT)));
    }

    private MatchRunResult withAnalytics(MatchRunResult result, int candidatesEvaluated) {
        result.setAnalytics(generateAnalytics(result, candidatesEvaluated));
        return result;
    }

    static MatchAnalytics generateAnalytics(MatchRunResult result, int candidatesEvaluated) {
        double average = 0.0;
        if (!result.getMatches().isEmpty()) {
            double sum = 0.0;
            for (MatchResult match : result.getMatches()) {
                sum += match.getRelevanceScore();
            }
            average = sum / result.getMatches().size();
        }

        QueryAnalysis analysis = result.getQueryAnalysis();
        int requirements = analysis == null ? 0 : analysis.requirementCount();
        String complexity = "simple";
        if (requirements > 6) {
            complexity = "complex";
        } else if (requirements > 3) {
            complexity = "moderate";
        }

        return new MatchAnalytics(complexity, analysis == null ? 0.0 : analysis.getConfidence(),
                candidatesEvaluated, average);
    }

    @Override
    public void close() {
        aiExecutor.shutdownNow();
    }

    /**
     * Bounded pool for AI calls. When every thread is busy and the queue is
     * full, submit() is rejected and the AI tier falls through.
     */
    static ThreadPoolExecutor newAiExecutor() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                MatchingConfig.AI_MAX_CONCURRENT_CALLS,
                MatchingConfig.AI_MAX_CONCURRENT_CALLS,
                MatchingConfig.AI_THREAD_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(MatchingConfig.AI_MAX_QUEUED_CALLS),
                daemonThreads(),
                new ThreadPoolExecutor.AbortPolicy());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ai-matcher-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
