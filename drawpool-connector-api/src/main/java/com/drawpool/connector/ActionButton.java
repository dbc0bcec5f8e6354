package com.drawpool.connector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Follow-up action offered by the backend for a finished image (upscale, variation, reroll...). */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ActionButton {

    private final String customId;
    private final String emoji;
    private final String label;
    private final int style;
    private final int type;

    @JsonCreator
    public ActionButton(
            @JsonProperty("customId") String customId,
            @JsonProperty("emoji") String emoji,
            @JsonProperty("label") String label,
            @JsonProperty("style") int style,
            @JsonProperty("type") int type) {
        this.customId = customId != null ? customId : "";
        this.emoji = emoji != null ? emoji : "";
        this.label = label != null ? label : "";
        this.style = style;
        this.type = type;
    }

    public String getCustomId() {
        return customId;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getLabel() {
        return label;
    }

    public int getStyle() {
        return style;
    }

    public int getType() {
        return type;
    }

    /** Image hash carried by this button's custom id. */
    public String imageHash() {
        return ImageHashes.fromCustomId(customId);
    }
}
