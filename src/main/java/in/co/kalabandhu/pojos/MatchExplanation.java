package in.co.kalabandhu.pojos;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Why a candidate received its score.
 */
public class MatchExplanation {

    // scoreBreakdown keys
    public static final String PROFESSION = "profession";
    public static final String SKILL = "skill";
    public static final String MATERIAL = "material";
    public static final String TECHNIQUE = "technique";
    public static final String EXPERIENCE = "experience";
    public static final String LOCATION = "location";
    public static final String PERFORMANCE = "performance";

    private static final List<String> SIGNALS =
            List.of(PROFESSION, SKILL, MATERIAL, TECHNIQUE, EXPERIENCE, LOCATION, PERFORMANCE);

    private String primaryReason;
    private List<String> detailedReasons;
    private Set<String> matchedSkills;
    private Set<String> matchedMaterials;
    private Set<String> matchedTechniques;
    private ConfidenceLevel confidenceLevel;
    private Map<String, Double> scoreBreakdown;

    public MatchExplanation(String primaryReason, List<String> detailedReasons,
                            Set<String> matchedSkills, Set<String> matchedMaterials,
                            Set<String> matchedTechniques, ConfidenceLevel confidenceLevel,
                            Map<String, Double> scoreBreakdown) {
        this.primaryReason = primaryReason;
        this.detailedReasons = detailedReasons == null ? List.of() : List.copyOf(detailedReasons);
        this.matchedSkills = copy(matchedSkills);
        this.matchedMaterials = copy(matchedMaterials);
        this.matchedTechniques = copy(matchedTechniques);
        this.confidenceLevel = confidenceLevel == null ? ConfidenceLevel.LOW : confidenceLevel;
        this.scoreBreakdown = zeroFilled(scoreBreakdown);
    }

    /**
     * Explanation carrying only reasons; every breakdown bucket is 0.
     */
    public static MatchExplanation of(String primaryReason, List<String> detailedReasons,
                                      ConfidenceLevel confidenceLevel) {
        return new MatchExplanation(primaryReason, detailedReasons, null, null, null, confidenceLevel, null);
    }

    private static Set<String> copy(Set<String> values) {
        return values == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    private static Map<String, Double> zeroFilled(Map<String, Double> values) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        for (String signal : SIGNALS) {
            Double value = values == null ? null : values.get(signal);
            breakdown.put(signal, value == null ? 0.0 : value);
        }
        return Collections.unmodifiableMap(breakdown);
    }

    public String getPrimaryReason() { return primaryReason; }
    public List<String> getDetailedReasons() { return detailedReasons; }
    public Set<String> getMatchedSkills() { return matchedSkills; }
    public Set<String> getMatchedMaterials() { return matchedMaterials; }
    public Set<String> getMatchedTechniques() { return matchedTechniques; }
    public ConfidenceLevel getConfidenceLevel() { return confidenceLevel; }
    public Map<String, Double> getScoreBreakdown() { return scoreBreakdown; }
}
