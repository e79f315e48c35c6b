package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.CandidateProfile;
import in.co.kalabandhu.pojos.KeywordMatch;
import in.co.kalabandhu.pojos.MatchField;
import in.co.kalabandhu.pojos.MatchType;

import java.util.List;

/**
 * Intermediate result of the deterministic scorer for one candidate.
 */
public class ScoredCandidate {
    public final CandidateProfile candidate;
    public final int originalIndex;
    public final double score;
    public final List<KeywordMatch> matches;

    public ScoredCandidate(CandidateProfile candidate, int originalIndex, double score, List<KeywordMatch> matches) {
        this.candidate = candidate;
        this.originalIndex = originalIndex;
        this.score = score;
        this.matches = List.copyOf(matches);
    }

    public boolean hasMatchOn(MatchField field) {
        for (KeywordMatch match : matches) {
            if (match.field == field) {
                return true;
            }
        }
        return false;
    }

    public boolean hasExactProfessionMatch() {
        for (KeywordMatch match : matches) {
            if (match.field == MatchField.PROFESSION && match.matchType == MatchType.EXACT) {
                return true;
            }
        }
        return false;
    }
}
