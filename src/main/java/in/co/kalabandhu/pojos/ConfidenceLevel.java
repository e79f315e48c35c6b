package in.co.kalabandhu.pojos;

import java.util.Locale;

public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
