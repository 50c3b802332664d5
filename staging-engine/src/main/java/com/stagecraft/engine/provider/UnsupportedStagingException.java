package com.stagecraft.engine.provider;

import com.stagecraft.engine.model.RoomCategory;
import com.stagecraft.engine.model.StyleProfile;

/**
 * No registered provider can stage the requested room/style pair.
 * Raised before a run exists, so it is an input error.
 */
public class UnsupportedStagingException extends RuntimeException {
    public UnsupportedStagingException(RoomCategory room, StyleProfile style) {
        super("No image provider supports " + room.wireName() + " / " + style.wireName());
    }
}
