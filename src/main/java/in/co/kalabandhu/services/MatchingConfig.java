package in.co.kalabandhu.services;

/**
 * Tunables for the matching engine: signal weights, thresholds and tier defaults.
 */
public class MatchingConfig {

    // Query analysis
    public static final int MIN_QUERY_LENGTH = 2;
    public static final double BASE_ANALYSIS_CONFIDENCE = 0.3;
    public static final double MAX_ANALYSIS_CONFIDENCE = 0.8;
    public static final double CONFIDENCE_PER_MATCH = 0.1;
    public static final double CONFIDENCE_PER_EXACT_MATCH = 0.1;

    // Deterministic scorer weights
    public static final double WEIGHT_PROFESSION_EXACT = 0.40;
    public static final double WEIGHT_PROFESSION_SYNONYM = 0.30;
    public static final double WEIGHT_MATERIAL = 0.20;
    public static final double WEIGHT_TECHNIQUE = 0.20;
    public static final double WEIGHT_SKILL = 0.15;
    public static final double WEIGHT_SPECIALIZATION = 0.10;
    public static final double WEIGHT_DESCRIPTION = 0.05;
    public static final double EXACT_PROFESSION_BOOST = 1.2;

    // Emergency scorer weights
    public static final double EMERGENCY_WEIGHT_PROFESSION = 0.30;
    public static final double EMERGENCY_WEIGHT_NAME = 0.10;
    public static final double EMERGENCY_WEIGHT_DESCRIPTION = 0.10;
    public static final int EMERGENCY_MIN_WORD_LENGTH = 3;
    public static final double EMERGENCY_CONFIDENCE = 0.1;
    public static final double EMERGENCY_PROFESSION_FLAG_THRESHOLD = 0.2;

    // Explanation confidence tiers (strictly greater than)
    public static final double HIGH_CONFIDENCE_THRESHOLD = 0.8;
    public static final double MEDIUM_CONFIDENCE_THRESHOLD = 0.6;
    public static final int MAX_DETAILED_REASONS = 5;

    // Tier defaults
    public static final double AI_DEFAULT_MIN_SCORE = 0.2;
    public static final int AI_DEFAULT_MAX_RESULTS = 20;
    public static final double DETERMINISTIC_DEFAULT_MIN_SCORE = 0.1;
    public static final int DETERMINISTIC_DEFAULT_MAX_RESULTS = 20;
    public static final double EMERGENCY_DEFAULT_MIN_SCORE = 0.05;
    public static final int EMERGENCY_DEFAULT_MAX_RESULTS = 10;

    // Reported by getFallbackCapabilities()
    public static final double FALLBACK_CAPABILITY_CONFIDENCE = 0.6;

    // The scorer checks for cancellation once per this many candidates
    public static final int CANCELLATION_CHECK_INTERVAL = 256;

    // AI matcher
    public static final long DEFAULT_AI_TIMEOUT_MS = 5000L;
    public static final String GEMINI_MODEL_NAME = "gemini-2.0-flash";
    public static final String GEMINI_API_KEY_NAME = "GEMINI_API_KEY";
    public static final int AI_MAX_CANDIDATES_IN_PROMPT = 100;
    // Bounds on the AI executor; a call stuck past its timeout still holds a thread
    public static final int AI_MAX_CONCURRENT_CALLS = 8;
    public static final int AI_MAX_QUEUED_CALLS = 32;
    public static final long AI_THREAD_KEEP_ALIVE_SECONDS = 60L;

    // quickMatch()
    public static final int QUICK_MATCH_DEFAULT_MAX_RESULTS = 10;

    // Synonym table data asset on the classpath
    public static final String SYNONYM_TABLES_RESOURCE = "synonym-tables.json";

    private MatchingConfig() {}
}
