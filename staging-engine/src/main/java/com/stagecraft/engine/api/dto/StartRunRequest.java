package com.stagecraft.engine.api.dto;

import com.stagecraft.engine.service.StartRunCommand;

/**
 * Request body for POST /runs.
 *
 * Required: imageUrl, roomCategory, styleProfile
 * Optional: width and height (together; omitted = unknown, the provider
 * picks its default size), stageSelection (omitted = every stage runs).
 */
public record StartRunRequest(
        String                imageUrl,
        Integer               width,
        Integer               height,
        String                roomCategory,
        String                styleProfile,
        StageSelectionRequest stageSelection
) {
    public StartRunCommand toCommand() {
        return new StartRunCommand(
                imageUrl,
                width == null ? 0 : width,
                height == null ? 0 : height,
                roomCategory,
                styleProfile,
                stageSelection == null ? null : stageSelection.toSelection());
    }
}
