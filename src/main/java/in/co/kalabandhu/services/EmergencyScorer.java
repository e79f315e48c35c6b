package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.CandidateProfile;
import in.co.kalabandhu.pojos.ConfidenceLevel;
import in.co.kalabandhu.pojos.MatchExplanation;
import in.co.kalabandhu.pojos.MatchOptions;
import in.co.kalabandhu.pojos.MatchResult;
import in.co.kalabandhu.pojos.MatchRunResult;
import in.co.kalabandhu.pojos.MatchingTier;
import in.co.kalabandhu.pojos.QueryAnalysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Last-resort matcher: plain substring scoring of the query words against
 * profession, name and description. Uses no tables and must not throw.
 */
public class EmergencyScorer {

    public static final String PRIMARY_REASON = "Simple text matching (emergency fallback)";

    private final ResultAssembler assembler;

    public EmergencyScorer(ResultAssembler assembler) {
        this.assembler = assembler;
    }

    private static class Scored {
        final CandidateProfile candidate;
        final double score;
        final List<String> reasons;

        Scored(CandidateProfile candidate, double score, List<String> reasons) {
            this.candidate = candidate;
            this.score = score;
            this.reasons = reasons;
        }
    }

    public MatchRunResult match(String query, List<CandidateProfile> candidates, MatchOptions options,
                                long tierStartMillis) {
        String normalized = QueryAnalyzer.normalize(query);
        Set<String> words = new LinkedHashSet<>();
        for (String word : normalized.split("\\s+")) {
            if (word.length() >= MatchingConfig.EMERGENCY_MIN_WORD_LENGTH) {
                words.add(word);
            }
        }

        List<Scored> scored = new ArrayList<>();
        if (candidates != null) {
            for (CandidateProfile candidate : candidates) {
                if (candidate != null) {
                    scored.add(score(candidate, words));
                }
            }
        }

        String location = options.getLocation();
        List<MatchResult> matches = assembler.assemble(scored, s -> s.score,
                s -> new MatchResult(s.candidate, s.score,
                        s.score > MatchingConfig.EMERGENCY_PROFESSION_FLAG_THRESHOLD,
                        false, false, false,
                        CandidateScorer.locationMatches(s.candidate, location),
                        MatchExplanation.of(PRIMARY_REASON, s.reasons, ConfidenceLevel.LOW)),
                options.minScoreOr(MatchingConfig.EMERGENCY_DEFAULT_MIN_SCORE),
                options.maxResultsOr(MatchingConfig.EMERGENCY_DEFAULT_MAX_RESULTS));

        QueryAnalysis analysis = new QueryAnalysis(query, normalized, words, null, null, null, null,
                MatchingConfig.EMERGENCY_CONFIDENCE, null);
        return assembler.toRunResult(matches, analysis, tierStartMillis,
                MatchingConfig.EMERGENCY_CONFIDENCE, true, MatchingTier.EMERGENCY);
    }

    private Scored score(CandidateProfile candidate, Set<String> words) {
        String profession = CandidateScorer.lower(candidate.getProfession());
        String name = CandidateScorer.lower(candidate.getName());
        String description = CandidateScorer.lower(candidate.getDescription());

        double score = 0.0;
        List<String> reasons = new ArrayList<>();
        for (String word : words) {
            if (profession.contains(word)) {
                score += MatchingConfig.EMERGENCY_WEIGHT_PROFESSION;
                reasons.add("Profession contains \"" + word + "\"");
            }
            if (name.contains(word)) {
                score += MatchingConfig.EMERGENCY_WEIGHT_NAME;
                reasons.add("Name contains \"" + word + "\"");
            }
            if (description.contains(word)) {
                score += MatchingConfig.EMERGENCY_WEIGHT_DESCRIPTION;
                reasons.add("Description contains \"" + word + "\"");
            }
        }
        if (reasons.size() > MatchingConfig.MAX_DETAILED_REASONS) {
            reasons = reasons.subList(0, MatchingConfig.MAX_DETAILED_REASONS);
        }
        return new Scored(candidate, Math.min(1.0, score), reasons);
    }
}
