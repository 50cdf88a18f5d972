package net.ogimage.application.render;

import java.util.List;
import java.util.Optional;
import net.ogimage.config.PipelineProperties;
import net.ogimage.util.UrlUtils;
import org.springframework.stereotype.Component;

/**
 * Whitelist predicate over the target URL's host.
 *
 * <p>A host is allowed when it equals a configured domain or is a subdomain of one. An empty
 * whitelist allows every host.</p>
 */
@Component
public class DomainAllowlistPolicy {

    private final List<String> allowedDomains;

    public DomainAllowlistPolicy(PipelineProperties properties) {
        this.allowedDomains = List.copyOf(properties.normalizedAllowedDomains());
    }

    public boolean isAllowed(String url) {
        Optional<String> host = UrlUtils.extractHost(url);
        if (host.isEmpty()) {
            return false;
        }
        if (allowedDomains.isEmpty()) {
            return true;
        }
        String candidate = host.get();
        for (String domain : allowedDomains) {
            if (candidate.equals(domain) || candidate.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }
}
