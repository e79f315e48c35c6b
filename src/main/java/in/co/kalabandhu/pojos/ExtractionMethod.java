package in.co.kalabandhu.pojos;

import java.util.Locale;

/**
 * How the query analyzer found its terms.
 */
public enum ExtractionMethod {
    KEYWORD,
    FUZZY,
    SYNONYM,
    HYBRID;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
