package in.co.kalabandhu.pojos;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Structured reading of a buyer query. Built once per request by the
 * QueryAnalyzer and never changed afterwards; sets keep detection order.
 */
public class QueryAnalysis {
    private final String originalQuery;
    private final String normalizedQuery;
    private final Set<String> detectedKeywords;
    private final Set<String> possibleProfessions;
    private final Set<String> exactProfessions;     // professions the query named by their canonical term
    private final Set<String> extractedMaterials;
    private final Set<String> extractedTechniques;
    private final double confidence;
    private final ExtractionMethod method;

    public QueryAnalysis(String originalQuery, String normalizedQuery,
                         Collection<String> detectedKeywords, Collection<String> possibleProfessions,
                         Collection<String> exactProfessions, Collection<String> extractedMaterials,
                         Collection<String> extractedTechniques, double confidence, ExtractionMethod method) {
        this.originalQuery = originalQuery == null ? "" : originalQuery;
        this.normalizedQuery = normalizedQuery == null ? "" : normalizedQuery;
        this.detectedKeywords = freeze(detectedKeywords);
        this.possibleProfessions = freeze(possibleProfessions);
        this.exactProfessions = freeze(exactProfessions);
        this.extractedMaterials = freeze(extractedMaterials);
        this.extractedTechniques = freeze(extractedTechniques);
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.method = method == null ? ExtractionMethod.KEYWORD : method;
    }

    /**
     * Analysis for a query that is empty or too short to read.
     */
    public static QueryAnalysis empty(String originalQuery) {
        String normalized = originalQuery == null ? "" : originalQuery.toLowerCase(Locale.ROOT).trim();
        return new QueryAnalysis(originalQuery, normalized, null, null, null, null, null,
                0.0, ExtractionMethod.KEYWORD);
    }

    private static Set<String> freeze(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    public boolean isEmpty() {
        return detectedKeywords.isEmpty() && possibleProfessions.isEmpty()
                && extractedMaterials.isEmpty() && extractedTechniques.isEmpty();
    }

    /**
     * Number of extracted requirements (materials + techniques + detected keywords).
     */
    public int requirementCount() {
        return extractedMaterials.size() + extractedTechniques.size() + detectedKeywords.size();
    }

    public String getOriginalQuery() { return originalQuery; }
    public String getNormalizedQuery() { return normalizedQuery; }
    public Set<String> getDetectedKeywords() { return detectedKeywords; }
    public Set<String> getPossibleProfessions() { return possibleProfessions; }
    public Set<String> getExactProfessions() { return exactProfessions; }
    public Set<String> getExtractedMaterials() { return extractedMaterials; }
    public Set<String> getExtractedTechniques() { return extractedTechniques; }
    public double getConfidence() { return confidence; }
    public ExtractionMethod getMethod() { return method; }

    /**
     * Human-readable reasoning line, as shown in search diagnostics.
     */
    public String describe() {
        return String.format(Locale.ROOT, "Fallback matching using %s method with %.2f confidence",
                method.getValue(), confidence);
    }
}
