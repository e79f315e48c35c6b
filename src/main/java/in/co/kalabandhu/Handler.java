package in.co.kalabandhu;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import in.co.kalabandhu.pojos.MatchFeedback;
import in.co.kalabandhu.pojos.MatchRequestBody;
import in.co.kalabandhu.pojos.MatchRunResult;
import in.co.kalabandhu.rest.ApiResponse;
import in.co.kalabandhu.services.ArtisanMatchingService;
import in.co.kalabandhu.services.LoggingService;

import java.util.Map;

/**
 * Lambda entry point for the artisan matching engine.
 *
 * The event is a Function URL payload; its "body" holds a JSON
 * MatchRequestBody whose "function" field selects the operation:
 * match_artisans, analyze_query, fallback_capabilities, match_feedback,
 * system_status. An unexpected exception inside an operation becomes a 500.
 * Scheduled EventBridge pings (source "aws.events") only warm the container.
 */
public class Handler implements RequestHandler<Map<String, Object>, Map<String, Object>> {

    private static final Gson gson = new GsonBuilder().create();

    private static volatile ArtisanMatchingService sharedService;

    private final ArtisanMatchingService matchingService;

    public Handler() {
        this(sharedService());
    }

    public Handler(ArtisanMatchingService matchingService) {
        this.matchingService = matchingService;
    }

    private static ArtisanMatchingService sharedService() {
        if (sharedService == null) {
            synchronized (Handler.class) {
                if (sharedService == null) {
                    sharedService = ArtisanMatchingService.createDefault();
                }
            }
        }
        return sharedService;
    }

    @Override
    public Map<String, Object> handleRequest(Map<String, Object> event, Context context) {
        LoggingService.initRequest(context);
        try {
            return route(event).toLambdaResponse();
        } catch (RuntimeException e) {
            LoggingService.error("request_failed", e);
            return ApiResponse.errorMessage("Internal error").toLambdaResponse();
        } finally {
            LoggingService.clearContext();
        }
    }

    ApiResponse route(Map<String, Object> event) {
        if (event == null) {
            return ApiResponse.badRequestMessage("Empty event");
        }
        if ("aws.events".equals(event.get("source"))) {
            LoggingService.info("warmup_ping");
            return ApiResponse.ok("Warmed up!");
        }

        Object rawBody = event.get("body");
        if (!(rawBody instanceof String) || ((String) rawBody).isBlank()) {
            return ApiResponse.badRequestMessage("Request body is required");
        }

        MatchRequestBody body;
        try {
            body = gson.fromJson((String) rawBody, MatchRequestBody.class);
        } catch (JsonParseException e) {
            LoggingService.warn("request_body_parse_failed", LoggingService.data("error", e.getMessage()));
            return ApiResponse.badRequestMessage("Malformed JSON body");
        }
        if (body == null || body.getFunction() == null) {
            return ApiResponse.badRequestMessage("Missing function");
        }

        LoggingService.setFunction(body.getFunction());
        switch (body.getFunction()) {
            case "match_artisans":
                return matchArtisans(body);
            case "analyze_query":
                return ApiResponse.ok(matchingService.analyzeQuery(body.getQuery()));
            case "fallback_capabilities":
                return ApiResponse.ok(matchingService.getFallbackCapabilities());
            case "match_feedback":
                return recordFeedback(body);
            case "system_status":
                return ApiResponse.ok(matchingService.getSystemStatus());
            default:
                return ApiResponse.badRequestMessage("Unknown function: " + body.getFunction());
        }
    }

    private ApiResponse matchArtisans(MatchRequestBody body) {
        if (body.getQuery() == null) {
            return ApiResponse.badRequestMessage("query is required");
        }
        MatchRunResult result = matchingService.matchArtisans(body.toMatchRequest());
        return ApiResponse.ok(result);
    }

    private ApiResponse recordFeedback(MatchRequestBody body) {
        MatchFeedback feedback = MatchFeedback.fromValue(body.getFeedback());
        if (feedback == null) {
            return ApiResponse.badRequestMessage("feedback must be positive or negative");
        }
        if (body.getSelectedCandidate() == null) {
            return ApiResponse.badRequestMessage("selectedCandidate is required");
        }
        matchingService.learnFromSuccessfulMatches(body.getQuery(), body.getSelectedCandidate(), feedback);
        return ApiResponse.ok(Map.of("recorded", true));
    }
}
