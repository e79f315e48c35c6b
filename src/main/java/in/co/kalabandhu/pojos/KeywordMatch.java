package in.co.kalabandhu.pojos;

/**
 * A single scoring signal that fired for a candidate.
 */
public class KeywordMatch {
    public final String keyword;
    public final MatchField field;
    public final double score;
    public final MatchType matchType;

    public KeywordMatch(String keyword, MatchField field, double score, MatchType matchType) {
        this.keyword = keyword;
        this.field = field;
        this.score = score;
        this.matchType = matchType;
    }

    @Override
    public String toString() {
        return field + ":" + keyword + "(" + matchType + "," + score + ")";
    }
}
