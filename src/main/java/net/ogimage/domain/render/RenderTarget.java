package net.ogimage.domain.render;

/**
 * Page and viewport a render task captures.
 *
 * @param url absolute http(s) URL of the page
 * @param width viewport width in pixels
 * @param height viewport height in pixels
 */
public record RenderTarget(String url, int width, int height) {

    public RenderTarget {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Render target url is required");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Render dimensions must be positive but were " + width + "x" + height);
        }
    }
}
