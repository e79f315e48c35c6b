package in.co.kalabandhu.services;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only vocabulary for the deterministic matcher: canonical profession,
 * material and technique terms with their synonyms, plus the product words
 * used to infer a profession the buyer never named.
 *
 * Built once (see SynonymTablesLoader) and shared by all requests. Every map
 * is unmodifiable and keeps the order of the source asset, which decides the
 * order keywords are detected in.
 */
public final class SynonymTables {

    private final String version;
    private final Map<String, List<String>> professions;
    private final Map<String, List<String>> materials;
    private final Map<String, List<String>> techniques;
    private final Map<String, List<String>> productCategories;
    private final Map<String, String> productProfessions;

    public SynonymTables(String version,
                         Map<String, List<String>> professions,
                         Map<String, List<String>> materials,
                         Map<String, List<String>> techniques,
                         Map<String, List<String>> productCategories,
                         Map<String, String> productProfessions) {
        this.version = version == null ? "unversioned" : version;
        this.professions = freeze(professions);
        this.materials = freeze(materials);
        this.techniques = freeze(techniques);
        this.productCategories = freeze(productCategories);
        this.productProfessions = productProfessions == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(normalizedCopy(productProfessions));
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<String, List<String>> entry : source.entrySet()) {
                List<String> terms = new ArrayList<>();
                if (entry.getValue() != null) {
                    for (String term : entry.getValue()) {
                        if (term != null && !term.isBlank()) {
                            terms.add(term.toLowerCase(Locale.ROOT).trim());
                        }
                    }
                }
                copy.put(entry.getKey().toLowerCase(Locale.ROOT).trim(), List.copyOf(terms));
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, String> normalizedCopy(Map<String, String> source) {
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((product, profession) -> {
            if (product != null && profession != null) {
                copy.put(product.toLowerCase(Locale.ROOT).trim(), profession.toLowerCase(Locale.ROOT).trim());
            }
        });
        return copy;
    }

    public String getVersion() { return version; }
    public Map<String, List<String>> getProfessions() { return professions; }
    public Map<String, List<String>> getMaterials() { return materials; }
    public Map<String, List<String>> getTechniques() { return techniques; }
    public Map<String, List<String>> getProductCategories() { return productCategories; }
    public Map<String, String> getProductProfessions() { return productProfessions; }

    /**
     * Synonyms of a canonical profession, empty when it is not in the table.
     */
    public List<String> professionSynonyms(String canonical) {
        return professions.getOrDefault(canonical, List.of());
    }

    /**
     * Profession implied by a product word ("chair" -> "woodworking"), or null.
     */
    public String inferProfession(String product) {
        return product == null ? null : productProfessions.get(product);
    }
}
