package net.ogimage.application.render;

/**
 * Caller-supplied render parameters before defaults are applied.
 *
 * @param url target page
 * @param ttlHours requested freshness window in hours, or null for the configured default
 * @param width viewport width, or null for the configured default
 * @param height viewport height, or null for the configured default
 * @param forceRefresh skip the cache check and render again
 */
public record ImageRequest(String url, Integer ttlHours, Integer width, Integer height, boolean forceRefresh) {

    public static ImageRequest of(String url) {
        return new ImageRequest(url, null, null, null, false);
    }
}
