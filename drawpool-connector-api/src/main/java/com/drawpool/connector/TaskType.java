package com.drawpool.connector;

/** Kind of generation work a {@link DrawTask} asks for. */
public enum TaskType {
    IMAGE,
    UPSCALE,
    VARIATION,
    BLEND,
    SWAP_FACE
}
