package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.MatchField;
import in.co.kalabandhu.pojos.MatchOptions;
import in.co.kalabandhu.pojos.MatchRequest;
import in.co.kalabandhu.pojos.MatchResult;
import in.co.kalabandhu.pojos.MatchingTier;
import in.co.kalabandhu.pojos.QueryAnalysis;

import java.util.List;

/**
 * Tier 2: keyword/synonym matching over the synonym tables.
 * Analyzer, scorer, explanation builder, then the result assembler.
 */
public class DeterministicMatchingStrategy implements MatchingStrategy {

    private final QueryAnalyzer analyzer;
    private final CandidateScorer scorer;
    private final ExplanationBuilder explanationBuilder;
    private final ResultAssembler assembler;

    public DeterministicMatchingStrategy(QueryAnalyzer analyzer, CandidateScorer scorer,
                                         ExplanationBuilder explanationBuilder, ResultAssembler assembler) {
        this.analyzer = analyzer;
        this.scorer = scorer;
        this.explanationBuilder = explanationBuilder;
        this.assembler = assembler;
    }

    @Override
    public MatchingTier tier() {
        return MatchingTier.DETERMINISTIC;
    }

    @Override
    public TierOutcome attempt(MatchRequest request) {
        long start = System.currentTimeMillis();
        MatchOptions options = request.getOptions();
        try {
            QueryAnalysis analysis = analyzer.analyze(request.getQuery(),
                    !Boolean.FALSE.equals(options.getEnableSynonymMatching()));
            if (analysis.isEmpty()) {
                // Only text overlap can score; expect a weak or empty result
                LoggingService.info("query_no_vocabulary_hits",
                        LoggingService.data("query", analysis.getNormalizedQuery()));
            }
            List<ScoredCandidate> scored = scorer.scoreAll(request.getCandidates(), analysis, options);

            List<MatchResult> matches = assembler.assemble(scored, s -> s.score,
                    s -> new MatchResult(s.candidate, s.score,
                            s.hasMatchOn(MatchField.PROFESSION),
                            s.hasMatchOn(MatchField.MATERIAL),
                            s.hasMatchOn(MatchField.TECHNIQUE),
                            s.hasMatchOn(MatchField.SPECIALIZATION),
                            CandidateScorer.locationMatches(s.candidate, options.getLocation()),
                            explanationBuilder.build(s.matches, s.score)),
                    options.minScoreOr(MatchingConfig.DETERMINISTIC_DEFAULT_MIN_SCORE),
                    options.maxResultsOr(MatchingConfig.DETERMINISTIC_DEFAULT_MAX_RESULTS));

            return TierOutcome.ok(assembler.toRunResult(matches, analysis, start,
                    analysis.getConfidence(), true, MatchingTier.DETERMINISTIC));
        } catch (MatchCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            return TierOutcome.fatal(e);
        }
    }
}
