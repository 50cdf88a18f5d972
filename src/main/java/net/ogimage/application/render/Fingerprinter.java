package net.ogimage.application.render;

import java.security.NoSuchAlgorithmException;
import net.ogimage.util.HashUtils;
import net.ogimage.util.UrlUtils;
import org.springframework.stereotype.Component;

/**
 * Derives the deterministic cache key for a render request.
 *
 * <p>The key is the SHA-256 of the canonical URL joined with the requested viewport, so it is
 * stable across restarts and across instances. Callers resolve default dimensions before
 * fingerprinting; an omitted width and an explicit default width produce the same key.</p>
 */
@Component
public class Fingerprinter {

    public String fingerprint(String url, int width, int height) {
        String material = UrlUtils.canonicalize(url) + "|" + width + "x" + height;
        try {
            return HashUtils.sha256Hex(material);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available on this JVM", ex);
        }
    }
}
