package in.co.kalabandhu.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.genai.Client;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
import in.co.kalabandhu.pojos.CandidateProfile;
import in.co.kalabandhu.pojos.MatchOptions;
import in.co.kalabandhu.pojos.SemanticMatchResult;
import in.co.kalabandhu.pojos.SemanticMatchResult.SemanticMatch;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ranks artisans with Google Gemini.
 *
 * The candidate list is sent as a numbered summary and the model answers
 * with JSON: {"confidence": 0.8, "matches": [{"index": 0, "score": 0.9, "reason": "..."}]}.
 * Indices are mapped back to the caller's profile objects.
 */
public class GeminiArtisanMatcher implements SemanticArtisanMatcher {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Client client;

    /**
     * Reads GEMINI_API_KEY from the environment or secrets.json. Without a
     * key the matcher stays unconfigured and the engine skips the AI tier.
     */
    public GeminiArtisanMatcher() {
        this(createClient());
    }

    public GeminiArtisanMatcher(Client client) {
        this.client = client;
    }

    private static Client createClient() {
        String apiKey = SecretsProvider.getString(MatchingConfig.GEMINI_API_KEY_NAME);
        if (apiKey.isEmpty()) {
            LoggingService.warn("gemini_no_api_key");
            return null;
        }
        LoggingService.info("gemini_initialized", Map.of("model", MatchingConfig.GEMINI_MODEL_NAME));
        return Client.builder().apiKey(apiKey).build();
    }

    @Override
    public boolean isConfigured() {
        return client != null;
    }

    @Override
    public String getModelName() {
        return MatchingConfig.GEMINI_MODEL_NAME;
    }

    @Override
    public SemanticMatchResult match(String query, List<CandidateProfile> candidates, MatchOptions options)
            throws Exception {
        if (!isConfigured()) {
            return SemanticMatchResult.error("GeminiArtisanMatcher not configured");
        }
        if (candidates == null || candidates.isEmpty()) {
            return SemanticMatchResult.success(0.0, List.of());
        }

        List<CandidateProfile> window = candidates.size() > MatchingConfig.AI_MAX_CANDIDATES_IN_PROMPT
                ? candidates.subList(0, MatchingConfig.AI_MAX_CANDIDATES_IN_PROMPT)
                : candidates;

        Content content = Content.fromParts(Part.fromText(buildPrompt(query, window)));
        GenerateContentConfig config = GenerateContentConfig.builder()
                .responseMimeType("application/json")
                .build();

        GenerateContentResponse response = client.models.generateContent(
                MatchingConfig.GEMINI_MODEL_NAME, content, config);

        String responseText = response.text();
        if (responseText == null || responseText.isEmpty()) {
            return SemanticMatchResult.error("Empty response from Gemini");
        }
        LoggingService.debug("gemini_match_response_received", Map.of("responseLength", responseText.length()));

        return parseResponse(responseText, window);
    }

    static String buildPrompt(String query, List<CandidateProfile> candidates) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You match buyers with Indian artisans.\n")
              .append("Buyer request: \"").append(query == null ? "" : query.trim()).append("\"\n\n")
              .append("Artisans:\n");
        for (int i = 0; i < candidates.size(); i++) {
            CandidateProfile c = candidates.get(i);
            if (c == null) {
                continue;
            }
            prompt.append(i).append(". ")
                  .append(orEmpty(c.getName())).append(" | profession: ").append(orEmpty(c.getProfession()))
                  .append(" | skills: ").append(join(c.getSkills()))
                  .append(" | materials: ").append(join(c.getMaterials()))
                  .append(" | techniques: ").append(join(c.getTechniques()))
                  .append(" | specializations: ").append(join(c.getSpecializations()))
                  .append(" | about: ").append(orEmpty(c.getDescription()))
                  .append('\n');
        }
        prompt.append("\nReturn only JSON of the form ")
              .append("{\"confidence\": <0-1>, \"matches\": [{\"index\": <artisan number>, ")
              .append("\"score\": <0-1>, \"reason\": \"<one sentence>\"}]} ")
              .append("listing relevant artisans, best first. Omit artisans that do not fit.");
        return prompt.toString();
    }

    /**
     * Parse the model's JSON answer. Out-of-range or repeated indices are
     * dropped; scores and confidence are clamped to [0,1].
     */
    static SemanticMatchResult parseResponse(String jsonText, List<CandidateProfile> candidates) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(jsonText));
        } catch (Exception e) {
            LoggingService.warn("gemini_json_parse_failed", LoggingService.data("error", e.getMessage()));
            return SemanticMatchResult.error("Failed to parse Gemini response as JSON");
        }
        if (root == null || !root.isObject()) {
            return SemanticMatchResult.error("Gemini response is not a JSON object");
        }

        List<SemanticMatch> matches = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (JsonNode node : root.path("matches")) {
            if (!node.path("index").canConvertToInt()) {
                continue;
            }
            int index = node.path("index").asInt();
            if (index < 0 || index >= candidates.size() || candidates.get(index) == null || !seen.add(index)) {
                continue;
            }
            matches.add(new SemanticMatch(candidates.get(index), clamp(node.path("score").asDouble(0.0)),
                    node.path("reason").asText(null)));
        }
        return SemanticMatchResult.success(clamp(root.path("confidence").asDouble(0.0)), matches);
    }

    private static String stripCodeFence(String jsonText) {
        String cleanJson = jsonText.trim();
        if (cleanJson.startsWith("```json")) {
            cleanJson = cleanJson.substring(7);
        } else if (cleanJson.startsWith("```")) {
            cleanJson = cleanJson.substring(3);
        }
        if (cleanJson.endsWith("```")) {
            cleanJson = cleanJson.substring(0, cleanJson.length() - 3);
        }
        return cleanJson.trim();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String join(List<String> values) {
        return values == null ? "" : String.join(", ", values);
    }
}
