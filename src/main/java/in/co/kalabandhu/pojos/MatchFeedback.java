package in.co.kalabandhu.pojos;

public enum MatchFeedback {
    POSITIVE,
    NEGATIVE;

    /**
     * Parse "positive"/"negative" (any case). Returns null for anything else.
     */
    public static MatchFeedback fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (MatchFeedback feedback : values()) {
            if (feedback.name().equalsIgnoreCase(value.trim())) {
                return feedback;
            }
        }
        return null;
    }
}
