package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.CandidateProfile;
import in.co.kalabandhu.pojos.KeywordMatch;
import in.co.kalabandhu.pojos.MatchField;
import in.co.kalabandhu.pojos.MatchOptions;
import in.co.kalabandhu.pojos.MatchType;
import in.co.kalabandhu.pojos.QueryAnalysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic relevance scoring of candidates against a QueryAnalysis.
 *
 * Each signal that fires adds its weight from MatchingConfig and is recorded
 * as a KeywordMatch for the explanation. The sum is optionally boosted for
 * exact profession hits and then clamped to 1.0. Null fields on a profile
 * are read as empty.
 */
public class CandidateScorer {

    private final SynonymTables tables;

    public CandidateScorer(SynonymTables tables) {
        this.tables = tables;
    }

    /**
     * Score every non-null candidate, in input order.
     *
     * @throws MatchCancelledException if the thread is interrupted while scoring
     */
    public List<ScoredCandidate> scoreAll(List<CandidateProfile> candidates, QueryAnalysis analysis,
                                          MatchOptions options) {
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            if (i % MatchingConfig.CANCELLATION_CHECK_INTERVAL == 0 && Thread.currentThread().isInterrupted()) {
                throw new MatchCancelledException(i);
            }
            CandidateProfile candidate = candidates.get(i);
            if (candidate == null) {
                continue;
            }
            scored.add(score(candidate, i, analysis, options));
        }
        return scored;
    }

    public ScoredCandidate score(CandidateProfile candidate, int originalIndex, QueryAnalysis analysis,
                                 MatchOptions options) {
        List<KeywordMatch> matches = new ArrayList<>();

        scoreProfession(lower(candidate.getProfession()), analysis, matches);
        scoreList(candidate.getMaterials(), analysis.getExtractedMaterials(), MatchField.MATERIAL,
                MatchingConfig.WEIGHT_MATERIAL, MatchType.EXACT, matches);
        scoreList(candidate.getTechniques(), analysis.getExtractedTechniques(), MatchField.TECHNIQUE,
                MatchingConfig.WEIGHT_TECHNIQUE, MatchType.EXACT, matches);
        scoreList(candidate.getSkills(), analysis.getDetectedKeywords(), MatchField.SKILL,
                MatchingConfig.WEIGHT_SKILL, MatchType.PARTIAL, matches);
        scoreList(candidate.getSpecializations(), analysis.getDetectedKeywords(), MatchField.SPECIALIZATION,
                MatchingConfig.WEIGHT_SPECIALIZATION, MatchType.PARTIAL, matches);

        String description = lower(candidate.getDescription());
        if (!description.isEmpty()) {
            for (String keyword : analysis.getDetectedKeywords()) {
                if (description.contains(keyword)) {
                    matches.add(new KeywordMatch(keyword, MatchField.DESCRIPTION,
                            MatchingConfig.WEIGHT_DESCRIPTION, MatchType.PARTIAL));
                }
            }
        }

        double total = 0.0;
        boolean exactProfession = false;
        for (KeywordMatch match : matches) {
            total += match.score;
            if (match.field == MatchField.PROFESSION && match.matchType == MatchType.EXACT) {
                exactProfession = true;
            }
        }
        if (options != null && options.isBoostExactMatches() && exactProfession) {
            total *= MatchingConfig.EXACT_PROFESSION_BOOST;
        }

        return new ScoredCandidate(candidate, originalIndex, Math.min(1.0, total), matches);
    }

    /**
     * A profession the query named canonically is an exact hit; one reached
     * through a synonym or a product word, or a candidate whose profession
     * only contains a synonym, is a synonym hit.
     */
    private void scoreProfession(String candidateProfession, QueryAnalysis analysis, List<KeywordMatch> matches) {
        if (candidateProfession.isEmpty()) {
            return;
        }
        for (String profession : analysis.getPossibleProfessions()) {
            if (candidateProfession.contains(profession)) {
                if (analysis.getExactProfessions().contains(profession)) {
                    matches.add(new KeywordMatch(profession, MatchField.PROFESSION,
                            MatchingConfig.WEIGHT_PROFESSION_EXACT, MatchType.EXACT));
                } else {
                    matches.add(new KeywordMatch(profession, MatchField.PROFESSION,
                            MatchingConfig.WEIGHT_PROFESSION_SYNONYM, MatchType.SYNONYM));
                }
                continue;
            }
            for (String synonym : tables.professionSynonyms(profession)) {
                if (candidateProfession.contains(synonym)) {
                    matches.add(new KeywordMatch(synonym, MatchField.PROFESSION,
                            MatchingConfig.WEIGHT_PROFESSION_SYNONYM, MatchType.SYNONYM));
                    break;
                }
            }
        }
    }

    /**
     * One signal per query term that overlaps any candidate entry (substring either way).
     */
    private void scoreList(List<String> candidateValues, Iterable<String> queryTerms, MatchField field,
                           double weight, MatchType matchType, List<KeywordMatch> matches) {
        if (candidateValues == null || candidateValues.isEmpty()) {
            return;
        }
        for (String term : queryTerms) {
            for (String value : candidateValues) {
                String candidateValue = lower(value);
                if (candidateValue.isEmpty()) {
                    continue;
                }
                if (candidateValue.contains(term) || term.contains(candidateValue)) {
                    matches.add(new KeywordMatch(term, field, weight, matchType));
                    break;
                }
            }
        }
    }

    /**
     * True when no location was requested, or the candidate's location mentions it.
     */
    static boolean locationMatches(CandidateProfile candidate, String requestedLocation) {
        if (requestedLocation == null || requestedLocation.isBlank()) {
            return true;
        }
        return lower(candidate.getLocation()).contains(requestedLocation.toLowerCase(Locale.ROOT).trim());
    }

    static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }
}
