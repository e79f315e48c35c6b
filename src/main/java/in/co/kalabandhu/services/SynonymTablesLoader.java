package in.co.kalabandhu.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads SynonymTables from the JSON data asset.
 *
 * Expected shape:
 * <pre>
 * {
 *   "version": "2024.1",
 *   "professions": { "pottery": ["ceramic", ...] },
 *   "materials": { ... },
 *   "techniques": { ... },
 *   "productCategories": { "furniture": ["table", ...] },
 *   "productProfessions": { "table": "woodworking" }
 * }
 * </pre>
 * Any problem is a startup failure and surfaces as IllegalStateException.
 */
public class SynonymTablesLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private SynonymTablesLoader() {}

    /**
     * Load the tables bundled with the service.
     */
    public static SynonymTables loadDefault() {
        return loadResource(MatchingConfig.SYNONYM_TABLES_RESOURCE);
    }

    public static SynonymTables loadResource(String resourceName) {
        InputStream in = SynonymTablesLoader.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            throw new IllegalStateException("Synonym tables resource not found: " + resourceName);
        }
        try (InputStream stream = in) {
            return load(stream);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read synonym tables resource " + resourceName, e);
        }
    }

    public static SynonymTables load(InputStream in) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Synonym tables are not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Synonym tables must be a JSON object");
        }

        SynonymTables tables = new SynonymTables(
                root.path("version").asText(null),
                readListTable(root, "professions", true),
                readListTable(root, "materials", true),
                readListTable(root, "techniques", true),
                readListTable(root, "productCategories", false),
                readInferenceTable(root, "productProfessions"));

        LoggingService.info("synonym_tables_loaded", LoggingService.data(
                "version", tables.getVersion(),
                "professions", tables.getProfessions().size(),
                "materials", tables.getMaterials().size(),
                "techniques", tables.getTechniques().size(),
                "products", tables.getProductProfessions().size()));
        return tables;
    }

    private static Map<String, List<String>> readListTable(JsonNode root, String name, boolean required) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            if (required) {
                throw new IllegalStateException("Synonym tables missing required section: " + name);
            }
            return Map.of();
        }
        if (!node.isObject()) {
            throw new IllegalStateException("Section " + name + " must be an object of string arrays");
        }

        Map<String, List<String>> table = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isArray()) {
                throw new IllegalStateException("Entry " + name + "." + entry.getKey() + " must be an array");
            }
            List<String> terms = new ArrayList<>();
            for (JsonNode term : entry.getValue()) {
                terms.add(term.asText());
            }
            table.put(entry.getKey(), terms);
        }
        return table;
    }

    private static Map<String, String> readInferenceTable(JsonNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new IllegalStateException("Section " + name + " must be an object of strings");
        }
        Map<String, String> table = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            table.put(entry.getKey(), entry.getValue().asText());
        }
        return table;
    }
}
