package in.co.kalabandhu.pojos;

import java.util.List;

/**
 * What the deterministic matcher can recognise, for status pages.
 */
public class FallbackCapabilities {
    private final List<String> supportedProfessions;
    private final List<String> supportedMaterials;
    private final List<String> supportedTechniques;
    private final List<String> matchingMethods;
    private final double confidence;
    private final String tablesVersion;

    public FallbackCapabilities(List<String> supportedProfessions, List<String> supportedMaterials,
                                List<String> supportedTechniques, List<String> matchingMethods,
                                double confidence, String tablesVersion) {
        this.supportedProfessions = List.copyOf(supportedProfessions);
        this.supportedMaterials = List.copyOf(supportedMaterials);
        this.supportedTechniques = List.copyOf(supportedTechniques);
        this.matchingMethods = List.copyOf(matchingMethods);
        this.confidence = confidence;
        this.tablesVersion = tablesVersion;
    }

    public List<String> getSupportedProfessions() { return supportedProfessions; }
    public List<String> getSupportedMaterials() { return supportedMaterials; }
    public List<String> getSupportedTechniques() { return supportedTechniques; }
    public List<String> getMatchingMethods() { return matchingMethods; }
    public double getConfidence() { return confidence; }
    public String getTablesVersion() { return tablesVersion; }
}
