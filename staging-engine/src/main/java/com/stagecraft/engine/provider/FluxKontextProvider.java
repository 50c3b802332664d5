package com.stagecraft.engine.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stagecraft.engine.model.ImageRef;
import com.stagecraft.engine.model.RoomCategory;
import com.stagecraft.engine.model.StyleProfile;
import com.stagecraft.engine.provider.dto.KontextResultResponse;
import com.stagecraft.engine.provider.dto.KontextSubmitResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Adapter for the FLUX.1 Kontext Pro image-editing API.
 *
 * Wire contract:
 * <pre>
 *   POST {base}/v1/flux-kontext-pro      x-key: {apiKey}   → {"id", "polling_url"}
 *   GET  {base}/v1/get_result?id={id}    x-key: {apiKey}   → {"id", "status", "result": {"sample"}}
 *   POST {webhook-url}  (provider → us)                    → {"task_id"|"id", "status", "result"}
 * </pre>
 *
 * The API is always asynchronous: submit returns a job id, never an image.
 */
@Component
public class FluxKontextProvider implements ImageProvider {

    private static final Logger log = LoggerFactory.getLogger(FluxKontextProvider.class);

    public static final String NAME = "flux-kontext";

    // Keep the provider from rewriting the instruction or embellishing the scene.
    private static final boolean PROMPT_UPSAMPLING = false;
    private static final String  OUTPUT_FORMAT     = "jpeg";
    private static final int     SAFETY_TOLERANCE  = 2;
    private static final double  GUIDANCE          = 3.5;

    private static final Set<String> FAILED_STATES =
            Set.of("Error", "Failed", "FAILED", "Content Moderated", "Request Moderated");
    private static final Set<String> READY_STATES = Set.of("Ready", "SUCCESS");

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final String       webhookUrl;
    private final Duration     requestTimeout;

    public FluxKontextProvider(
            @Value("${stagecraft.provider.flux.base-url:https://api.bfl.ml}") String baseUrl,
            @Value("${stagecraft.provider.flux.api-key:}") String apiKey,
            @Value("${stagecraft.provider.flux.webhook-url:}") String webhookUrl,
            @Value("${stagecraft.provider.flux.request-timeout:30s}") Duration requestTimeout,
            ObjectMapper objectMapper) {
        this.baseUrl        = stripTrailingSlash(baseUrl);
        this.apiKey         = apiKey;
        this.webhookUrl     = webhookUrl;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("stagecraft.provider.flux.api-key is not set; calls to {} will be rejected", this.baseUrl);
        }
    }

    @Override
    public String name() { return NAME; }

    /** Kontext edits arbitrary interiors; there is no room or style it refuses. */
    @Override
    public boolean supports(RoomCategory room, StyleProfile style) {
        return true;
    }

    @Override
    public SizeConstraints sizeConstraints() {
        return SizeConstraints.DEFAULT;
    }

    // ------------------------------------------------------------------
    // Submit
    // ------------------------------------------------------------------

    @Override
    public SubmitResult submit(GenerationRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt",            request.instruction());
        body.put("input_image",       request.inputImage().url());
        if (request.hasSize()) {
            body.put("width",         request.width());
            body.put("height",        request.height());
            body.put("aspect_ratio",  request.aspectRatio());
        }
        body.put("prompt_upsampling", PROMPT_UPSAMPLING);
        body.put("output_format",     OUTPUT_FORMAT);
        body.put("safety_tolerance",  SAFETY_TOLERANCE);
        body.put("guidance",          GUIDANCE);
        if (webhookUrl != null && !webhookUrl.isBlank()) {
            body.put("webhook_url", webhookUrl);
        }

        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/flux-kontext-pro"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body))), "submit");

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ProviderException(ProviderException.Kind.HTTP_STATUS,
                    "submit failed: HTTP " + resp.statusCode() + ": " + resp.body());
        }
        KontextSubmitResponse parsed = parse(resp.body(), KontextSubmitResponse.class, "submit");
        if (parsed.id() == null || parsed.id().isBlank()) {
            throw new ProviderException(ProviderException.Kind.MALFORMED_RESPONSE,
                    "submit response carries no job id: " + resp.body());
        }
        log.info("Submitted Kontext job {} ({}x{})", parsed.id(), request.width(), request.height());
        return SubmitResult.submitted(parsed.id());
    }

    // ------------------------------------------------------------------
    // Poll
    // ------------------------------------------------------------------

    @Override
    public JobStatus poll(String jobHandle) {
        String id = URLEncoder.encode(jobHandle, StandardCharsets.UTF_8);
        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/get_result?id=" + id))
                .GET(), "poll");

        // A job that was just submitted can briefly be unknown to the result store.
        if (resp.statusCode() == 404) {
            log.debug("Kontext job {} not found yet; treating as pending", jobHandle);
            return JobStatus.PENDING;
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ProviderException(ProviderException.Kind.HTTP_STATUS,
                    "poll failed for " + jobHandle + ": HTTP " + resp.statusCode() + ": " + resp.body());
        }
        KontextResultResponse parsed = parse(resp.body(), KontextResultResponse.class, "poll");
        return toStatus(parsed.status(), parsed.result(), parsed.details(), jobHandle);
    }

    // ------------------------------------------------------------------
    // Webhook
    // ------------------------------------------------------------------

    /**
     * Webhook bodies name the job under "task_id" (newer payloads) or "id",
     * and report "SUCCESS"/"Ready" or "FAILED"/"Error". result.sample is
     * either the image URL or an object with a "url" field.
     */
    @Override
    public ProviderCallback parseCallback(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new MalformedCallbackException("Webhook body must be a JSON object");
        }
        String handle = text(body, "task_id");
        if (handle == null) handle = text(body, "id");
        if (handle == null) {
            throw new MalformedCallbackException("Webhook body carries neither task_id nor id");
        }
        return new ProviderCallback(handle,
                toStatus(text(body, "status"), body.get("result"), body.get("details"), handle));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private JobStatus toStatus(String status, JsonNode result, JsonNode details, String jobHandle) {
        if (status != null && READY_STATES.contains(status)) {
            String url = sampleUrl(result);
            if (url == null) {
                return JobStatus.failed("Job " + jobHandle + " is " + status + " but carries no image");
            }
            return JobStatus.succeeded(ImageRef.of(url));
        }
        if (status != null && FAILED_STATES.contains(status)) {
            String reason = details == null || details.isNull() ? status : status + ": " + details;
            return JobStatus.failed(reason);
        }
        return JobStatus.PENDING;
    }

    private static String sampleUrl(JsonNode result) {
        if (result == null || result.isNull()) return null;
        JsonNode sample = result.get("sample");
        if (sample == null || sample.isNull()) return null;
        if (sample.isTextual()) return sample.asText().isBlank() ? null : sample.asText();
        if (sample.isObject()) return text(sample, "url");
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    private HttpResponse<String> send(HttpRequest.Builder builder, String opName) {
        HttpRequest req = builder
                .timeout(requestTimeout)
                .header("x-key", apiKey == null ? "" : apiKey)
                .header("Accept", "application/json")
                .build();
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.TRANSPORT, opName + " interrupted", e);
        } catch (Exception e) {
            throw new ProviderException(ProviderException.Kind.TRANSPORT,
                    opName + " failed: " + e.getMessage(), e);
        }
    }

    private <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.MALFORMED_RESPONSE,
                    "Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.MALFORMED_RESPONSE,
                    "JSON serialization failed", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
