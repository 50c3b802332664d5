package com.stagecraft.engine.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response from GET /v1/get_result.
 *
 * status is one of "Pending", "Ready", "Error", "Failed", "Content Moderated",
 * "Request Moderated" or "Task not found". result is only set once Ready and
 * carries the image URL under "sample".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KontextResultResponse(
        String   id,
        String   status,
        JsonNode result,
        JsonNode details
) {}
