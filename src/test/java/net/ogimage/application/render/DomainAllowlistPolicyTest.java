package net.ogimage.application.render;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import net.ogimage.config.PipelineProperties;
import org.junit.jupiter.api.Test;

class DomainAllowlistPolicyTest {

    @Test
    void emptyAllowlist_AllowsAnyHttpUrl() {
        DomainAllowlistPolicy policy = new DomainAllowlistPolicy(new PipelineProperties());

        assertTrue(policy.isAllowed("https://anything.example.org/page"));
        assertFalse(policy.isAllowed("ftp://anything.example.org/file"));
    }

    @Test
    void allowlist_MatchesExactDomainAndSubdomains() {
        PipelineProperties properties = new PipelineProperties();
        properties.setAllowedDomains(List.of(" Example.com ", "ogimage.net"));
        DomainAllowlistPolicy policy = new DomainAllowlistPolicy(properties);

        assertTrue(policy.isAllowed("https://example.com"));
        assertTrue(policy.isAllowed("https://blog.example.com/post"));
        assertTrue(policy.isAllowed("https://OGIMAGE.net/about"));
        assertFalse(policy.isAllowed("https://notexample.com"));
        assertFalse(policy.isAllowed("https://example.com.evil.net"));
    }
}
