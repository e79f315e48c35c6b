package in.co.kalabandhu;

import com.amazonaws.services.lambda.runtime.Context;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import in.co.kalabandhu.services.ArtisanMatchingService;
import in.co.kalabandhu.services.MockSemanticArtisanMatcher;
import in.co.kalabandhu.services.SynonymTablesLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HandlerUnitTest {

    @Mock
    private Context context;

    private ArtisanMatchingService matchingService;
    private Handler handler;

    private static final String CANDIDATES_JSON = "["
            + "{\"id\": \"p1\", \"name\": \"Ravi Kumar\", \"profession\": \"Pottery\", \"location\": \"Jaipur\"},"
            + "{\"id\": \"w1\", \"name\": \"Anita Sharma\", \"profession\": \"Woodworking\", \"materials\": [\"Teak\"]}"
            + "]";

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(context.getAwsRequestId()).thenReturn("test-request-id");
        matchingService = new ArtisanMatchingService(SynonymTablesLoader.loadDefault(),
                MockSemanticArtisanMatcher.unconfigured());
        handler = new Handler(matchingService);
    }

    @AfterEach
    void tearDown() {
        matchingService.close();
    }

    private static Map<String, Object> event(String body) {
        Map<String, Object> event = new HashMap<>();
        event.put("body", body);
        return event;
    }

    private static JsonObject body(Map<String, Object> response) {
        return JsonParser.parseString((String) response.get("body")).getAsJsonObject();
    }

    @Test
    void testWarmupRequest() {
        Map<String, Object> event = new HashMap<>();
        event.put("source", "aws.events");

        Map<String, Object> response = handler.handleRequest(event, context);

        assertEquals(200, response.get("statusCode"));
        assertEquals("Warmed up!", body(response).get("data").getAsString());
    }

    @Test
    void testMatchArtisans() {
        String requestBody = "{\"function\": \"match_artisans\", \"query\": \"pottery\", \"candidates\": "
                + CANDIDATES_JSON + ", \"options\": {\"maxResults\": 5}}";

        Map<String, Object> response = handler.handleRequest(event(requestBody), context);

        assertEquals(200, response.get("statusCode"));
        JsonObject data = body(response).getAsJsonObject("data");
        assertEquals("DETERMINISTIC", data.get("tierUsed").getAsString());
        assertTrue(data.get("fallbackUsed").getAsBoolean());
        assertEquals(1, data.get("totalFound").getAsInt());
        JsonObject top = data.getAsJsonArray("matches").get(0).getAsJsonObject();
        assertEquals("p1", top.getAsJsonObject("candidate").get("id").getAsString());
        assertEquals(1, top.get("rank").getAsInt());
        verify(context, atLeastOnce()).getAwsRequestId();
    }

    @Test
    void testMatchArtisans_MissingQuery() {
        Map<String, Object> response = handler.handleRequest(
                event("{\"function\": \"match_artisans\", \"candidates\": []}"), context);

        assertEquals(400, response.get("statusCode"));
    }

    @Test
    void testAnalyzeQuery() {
        Map<String, Object> response = handler.handleRequest(
                event("{\"function\": \"analyze_query\", \"query\": \"wooden chair\"}"), context);

        assertEquals(200, response.get("statusCode"));
        JsonObject data = body(response).getAsJsonObject("data");
        assertEquals("woodworking", data.getAsJsonArray("possibleProfessions").get(0).getAsString());
    }

    @Test
    void testFallbackCapabilities() {
        Map<String, Object> response = handler.handleRequest(
                event("{\"function\": \"fallback_capabilities\"}"), context);

        assertEquals(200, response.get("statusCode"));
        assertEquals(0.6, body(response).getAsJsonObject("data").get("confidence").getAsDouble(), 1e-9);
    }

    @Test
    void testMatchFeedback() {
        String requestBody = "{\"function\": \"match_feedback\", \"query\": \"pottery\", \"feedback\": \"positive\","
                + " \"selectedCandidate\": {\"id\": \"p1\"}}";

        Map<String, Object> response = handler.handleRequest(event(requestBody), context);

        assertEquals(200, response.get("statusCode"));
        assertTrue(body(response).getAsJsonObject("data").get("recorded").getAsBoolean());
    }

    @Test
    void testMatchFeedback_InvalidFeedback() {
        String requestBody = "{\"function\": \"match_feedback\", \"feedback\": \"meh\", \"selectedCandidate\": {\"id\": \"p1\"}}";

        Map<String, Object> response = handler.handleRequest(event(requestBody), context);

        assertEquals(400, response.get("statusCode"));
    }

    @Test
    void testSystemStatus() {
        Map<String, Object> response = handler.handleRequest(event("{\"function\": \"system_status\"}"), context);

        assertEquals(200, response.get("statusCode"));
        JsonObject data = body(response).getAsJsonObject("data");
        assertFalse(data.get("aiConfigured").getAsBoolean());
        assertEquals("mock", data.get("aiModel").getAsString());
        assertEquals("2024.1", data.get("tablesVersion").getAsString());
        assertTrue(data.get("totalProfessions").getAsInt() > 0);
    }

    @Test
    void testOperationThrows_Returns500() {
        // Arrange
        ArtisanMatchingService failing = mock(ArtisanMatchingService.class);
        when(failing.getFallbackCapabilities()).thenThrow(new IllegalStateException("tables unavailable"));
        Handler failingHandler = new Handler(failing);

        // Act
        Map<String, Object> response = failingHandler.handleRequest(
                event("{\"function\": \"fallback_capabilities\"}"), context);

        // Assert
        assertEquals(500, response.get("statusCode"));
        JsonObject json = body(response);
        assertFalse(json.get("success").getAsBoolean());
        assertEquals("Internal error", json.get("errorMessage").getAsString());
    }

    @Test
    void testUnknownFunction() {
        Map<String, Object> response = handler.handleRequest(event("{\"function\": \"make_admin\"}"), context);

        assertEquals(400, response.get("statusCode"));
        assertTrue(body(response).get("errorMessage").getAsString().contains("make_admin"));
    }

    @Test
    void testMalformedBody() {
        Map<String, Object> response = handler.handleRequest(event("not json at all"), context);

        assertEquals(400, response.get("statusCode"));
        assertFalse(body(response).get("success").getAsBoolean());
    }

    @Test
    void testMissingBody() {
        Map<String, Object> response = handler.handleRequest(new HashMap<>(), context);

        assertEquals(400, response.get("statusCode"));
    }

    @Test
    void testResponseHeaders() {
        Map<String, Object> response = handler.handleRequest(
                event("{\"function\": \"fallback_capabilities\"}"), context);

        @SuppressWarnings("unchecked")
        Map<String, String> headers = (Map<String, String>) response.get("headers");
        assertEquals("application/json", headers.get("Content-Type"));
    }
}
