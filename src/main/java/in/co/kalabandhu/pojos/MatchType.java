package in.co.kalabandhu.pojos;

public enum MatchType {
    EXACT,
    PARTIAL,
    FUZZY,
    SYNONYM
}
