package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.CandidateProfile;
import in.co.kalabandhu.pojos.ConfidenceLevel;
import in.co.kalabandhu.pojos.KeywordMatch;
import in.co.kalabandhu.pojos.MatchExplanation;
import in.co.kalabandhu.pojos.MatchField;
import in.co.kalabandhu.pojos.MatchResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns the signals that fired for a candidate into a MatchExplanation.
 */
public class ExplanationBuilder {

    public static final String FALLBACK_PRIMARY_REASON = "Basic keyword matching (fallback mode)";

    public MatchExplanation build(List<KeywordMatch> matches, double score) {
        List<String> professions = keywordsFor(matches, MatchField.PROFESSION);
        List<String> materials = keywordsFor(matches, MatchField.MATERIAL);
        List<String> techniques = keywordsFor(matches, MatchField.TECHNIQUE);
        List<String> skills = keywordsFor(matches, MatchField.SKILL);

        // Priority order: profession, material, technique, skill
        List<String> reasons = new ArrayList<>();
        if (!professions.isEmpty()) {
            reasons.add("Profession matches: " + String.join(", ", professions));
        }
        if (!materials.isEmpty()) {
            reasons.add("Material expertise: " + String.join(", ", materials));
        }
        if (!techniques.isEmpty()) {
            reasons.add("Technique skills: " + String.join(", ", techniques));
        }
        if (!skills.isEmpty()) {
            reasons.add("Relevant skills: " + String.join(", ", skills));
        }

        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put(MatchExplanation.PROFESSION, sumFor(matches, MatchField.PROFESSION));
        breakdown.put(MatchExplanation.SKILL, sumFor(matches, MatchField.SKILL));
        breakdown.put(MatchExplanation.MATERIAL, sumFor(matches, MatchField.MATERIAL));
        breakdown.put(MatchExplanation.TECHNIQUE, sumFor(matches, MatchField.TECHNIQUE));

        return new MatchExplanation(
                reasons.isEmpty() ? FALLBACK_PRIMARY_REASON : reasons.get(0),
                reasons.subList(0, Math.min(reasons.size(), MatchingConfig.MAX_DETAILED_REASONS)),
                new LinkedHashSet<>(skills),
                new LinkedHashSet<>(materials),
                new LinkedHashSet<>(techniques),
                confidenceLevelFor(score),
                breakdown);
    }

    public static ConfidenceLevel confidenceLevelFor(double score) {
        if (score > MatchingConfig.HIGH_CONFIDENCE_THRESHOLD) {
            return ConfidenceLevel.HIGH;
        }
        if (score > MatchingConfig.MEDIUM_CONFIDENCE_THRESHOLD) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    /**
     * One-line summary for list views, e.g. "Ravi Kumar is a Pottery with a 40% match score."
     */
    public String basicSummary(MatchResult match) {
        CandidateProfile candidate = match.getCandidate();
        String name = candidate == null || candidate.getName() == null ? "This artisan" : candidate.getName();
        String profession = candidate == null || candidate.getProfession() == null
                ? "artisan" : candidate.getProfession();
        return String.format(Locale.ROOT, "%s is a %s with a %d%% match score.",
                name, profession, Math.round(match.getRelevanceScore() * 100));
    }

    private static List<String> keywordsFor(List<KeywordMatch> matches, MatchField field) {
        Set<String> keywords = new LinkedHashSet<>();
        for (KeywordMatch match : matches) {
            if (match.field == field) {
                keywords.add(match.keyword);
            }
        }
        return new ArrayList<>(keywords);
    }

    private static double sumFor(List<KeywordMatch> matches, MatchField field) {
        double sum = 0.0;
        for (KeywordMatch match : matches) {
            if (match.field == field) {
                sum += match.score;
            }
        }
        return sum;
    }
}
