package net.ogimage.application.render;

import java.time.Duration;
import net.ogimage.domain.render.RenderTarget;
import net.ogimage.exception.RenderFailedException;

/**
 * Turns a page into PNG bytes.
 */
public interface PageRenderer {

    /**
     * Renders the target with the given viewport.
     *
     * @param target page and viewport
     * @param pageLoadTimeout upper bound the renderer should apply to page loading
     * @return PNG image bytes
     * @throws RenderFailedException when the page cannot be loaded or captured
     */
    byte[] render(RenderTarget target, Duration pageLoadTimeout);
}
