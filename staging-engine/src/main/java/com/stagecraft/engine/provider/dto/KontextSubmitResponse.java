package com.stagecraft.engine.provider.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /v1/flux-kontext-pro.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KontextSubmitResponse(
        String id,
        String polling_url
) {}
