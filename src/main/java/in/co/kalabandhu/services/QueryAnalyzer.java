package in.co.kalabandhu.services;

import in.co.kalabandhu.pojos.ExtractionMethod;
import in.co.kalabandhu.pojos.QueryAnalysis;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Keyword/synonym reading of a buyer query against the SynonymTables.
 *
 * Matching is plain substring containment on the lower-cased query, so
 * "pottery" also contains the product word "pot". That is intended: product
 * hits raise confidence and let a query like "wooden chair" reach
 * woodworking without naming it.
 */
public class QueryAnalyzer {

    private final SynonymTables tables;

    public QueryAnalyzer(SynonymTables tables) {
        this.tables = tables;
    }

    public QueryAnalysis analyze(String query) {
        return analyze(query, true);
    }

    /**
     * @param query              raw buyer text
     * @param synonymsEnabled    when false only canonical terms and product words are recognised
     */
    public QueryAnalysis analyze(String query, boolean synonymsEnabled) {
        String normalized = normalize(query);
        if (normalized.length() < MatchingConfig.MIN_QUERY_LENGTH) {
            return QueryAnalysis.empty(query);
        }

        Extraction extraction = new Extraction();
        Set<String> professions = extraction.scan(tables.getProfessions(), normalized, synonymsEnabled, true);
        Set<String> materials = extraction.scan(tables.getMaterials(), normalized, synonymsEnabled, false);
        Set<String> techniques = extraction.scan(tables.getTechniques(), normalized, synonymsEnabled, false);

        // Product words: every hit counts, and may imply a profession
        for (List<String> products : tables.getProductCategories().values()) {
            for (String product : products) {
                if (normalized.contains(product)) {
                    extraction.keywords.add(product);
                    extraction.totalMatches++;
                    String inferred = tables.inferProfession(product);
                    if (inferred != null) {
                        professions.add(inferred);
                    }
                }
            }
        }

        double confidence = MatchingConfig.BASE_ANALYSIS_CONFIDENCE;
        if (extraction.totalMatches > 0) {
            confidence = Math.min(MatchingConfig.MAX_ANALYSIS_CONFIDENCE,
                    MatchingConfig.BASE_ANALYSIS_CONFIDENCE
                            + extraction.totalMatches * MatchingConfig.CONFIDENCE_PER_MATCH
                            + extraction.exactMatches * MatchingConfig.CONFIDENCE_PER_EXACT_MATCH);
        }

        ExtractionMethod method = ExtractionMethod.KEYWORD;
        if (extraction.exactMatches > 0 && extraction.totalMatches > extraction.exactMatches) {
            method = ExtractionMethod.HYBRID;
        } else if (extraction.totalMatches > extraction.exactMatches) {
            method = ExtractionMethod.SYNONYM;
        }

        QueryAnalysis analysis = new QueryAnalysis(query, normalized, extraction.keywords, professions,
                extraction.exactProfessions, materials, techniques, confidence, method);

        LoggingService.debug("query_analyzed", LoggingService.data(
                "keywords", analysis.getDetectedKeywords(),
                "professions", analysis.getPossibleProfessions(),
                "confidence", analysis.getConfidence(),
                "method", method.getValue()));
        return analysis;
    }

    static String normalize(String query) {
        return query == null ? "" : query.toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Mutable counters for a single analyze() call.
     */
    private static class Extraction {
        final Set<String> keywords = new LinkedHashSet<>();
        final Set<String> exactProfessions = new LinkedHashSet<>();
        int totalMatches;
        int exactMatches;

        /**
         * One hit per canonical term at most: the canonical word itself, or
         * else the first synonym contained in the query.
         */
        Set<String> scan(Map<String, List<String>> table, String query, boolean synonymsEnabled,
                         boolean professionTable) {
            Set<String> found = new LinkedHashSet<>();
            for (Map.Entry<String, List<String>> entry : table.entrySet()) {
                String canonical = entry.getKey();
                if (query.contains(canonical)) {
                    found.add(canonical);
                    keywords.add(canonical);
                    if (professionTable) {
                        exactProfessions.add(canonical);
                    }
                    exactMatches++;
                    totalMatches++;
                } else if (synonymsEnabled) {
                    for (String synonym : entry.getValue()) {
                        if (query.contains(synonym)) {
                            found.add(canonical);
                            keywords.add(synonym);
                            totalMatches++;
                            break;
                        }
                    }
                }
            }
            return found;
        }
    }
}
