package com.stagecraft.engine.service;

import com.stagecraft.engine.model.StageSelection;

/**
 * Raw input of a new staging run, exactly as the caller sent it. Room and
 * style are wire names and get validated by the workflow.
 *
 * @param stageSelection null keeps every stage
 */
public record StartRunCommand(
        String         imageUrl,
        int            width,
        int            height,
        String         roomCategory,
        String         styleProfile,
        StageSelection stageSelection
) {}
