package com.drawpool.connector;

/**
 * Derives the variant hash of a generated image from a follow-up action's custom id,
 * e.g. {@code MJ::JOB::upsample::1::3f2a...} yields {@code 3f2a...}.
 */
public final class ImageHashes {

    private ImageHashes() {
    }

    public static String fromCustomId(String customId) {
        if (customId == null || customId.isEmpty()) {
            return "";
        }
        String[] parts = customId.split("::", -1);
        if (parts.length > 5) {
            return parts[4];
        }
        return parts[parts.length - 1];
    }
}
