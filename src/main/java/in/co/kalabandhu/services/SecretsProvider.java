package in.co.kalabandhu.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Secrets for outbound integrations (currently only the Gemini API key).
 *
 * An environment variable with the same name wins over secrets.json, so the
 * Lambda can be configured without shipping the file. The file is read once.
 */
class SecretsProvider {

    static final String SECRETS_FILE = "secrets.json";

    private static volatile Map<String, String> cache;

    private SecretsProvider() {}

    /**
     * Returns the secret for the key, or an empty string when it is not set anywhere.
     */
    static String getString(String key) {
        String fromEnv = System.getenv(key);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        if (cache == null) {
            synchronized (SecretsProvider.class) {
                if (cache == null) {
                    cache = loadSecrets(new File(SECRETS_FILE));
                }
            }
        }
        return cache.getOrDefault(key, "");
    }

    static Map<String, String> loadSecrets(File file) {
        Map<String, String> map = new HashMap<>();
        if (!file.exists()) {
            LoggingService.debug("secrets_file_absent", Map.of("path", file.getPath()));
            return map;
        }
        try {
            JsonNode rootNode = new ObjectMapper().readTree(file);
            Iterator<Map.Entry<String, JsonNode>> fields = rootNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                map.put(entry.getKey(), entry.getValue().asText(""));
            }
        } catch (Exception e) {
            LoggingService.error("secrets_provider_load_failed", e);
        }
        return map;
    }
}
