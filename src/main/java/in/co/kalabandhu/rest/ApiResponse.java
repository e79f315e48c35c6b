package in.co.kalabandhu.rest;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.HashMap;
import java.util.Map;

/**
 * Lambda Function URL response: statusCode, headers and a JSON body.
 */
public class ApiResponse {

    private static final Gson gson = new GsonBuilder().create();

    private final int statusCode;
    private final Map<String, String> headers;
    private final String body;

    ApiResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body;
        this.headers = new HashMap<>();
        this.headers.put("Content-Type", "application/json");
    }

    /**
     * When a Function URL handler returns a map with statusCode/headers/body,
     * Lambda uses those values instead of wrapping the payload in a 200.
     */
    public Map<String, Object> toLambdaResponse() {
        Map<String, Object> response = new HashMap<>();
        response.put("statusCode", statusCode);
        response.put("headers", headers);
        response.put("body", body);
        return response;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    // --- Factory Methods ---

    /**
     * 200 with {"success": true, "data": ...}.
     */
    public static ApiResponse ok(Object data) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("success", true);
        payload.put("data", data);
        return new ApiResponse(200, gson.toJson(payload));
    }

    public static ApiResponse badRequestMessage(String message) {
        return new ApiResponse(400, gson.toJson(Map.of("success", false, "errorMessage", message)));
    }

    public static ApiResponse errorMessage(String message) {
        return new ApiResponse(500, gson.toJson(Map.of("success", false, "errorMessage", message)));
    }
}
