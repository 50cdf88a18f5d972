package net.ogimage.config;

import java.time.Duration;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class PipelinePropertiesTest {

    @Test
    void defaultsAreValid() {
        PipelineProperties properties = new PipelineProperties();

        assertDoesNotThrow(properties::validate);
        assertThat(properties.defaultTtl()).isEqualTo(Duration.ofHours(24));
    }

    @Test
    void shouldRejectPageLoadTimeoutAboveRenderTimeout() {
        PipelineProperties properties = new PipelineProperties();
        properties.setRenderTimeout(Duration.ofSeconds(10));
        properties.setPageLoadTimeout(Duration.ofSeconds(20));

        assertThatThrownBy(properties::validate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("page-load-timeout");
    }

    @Test
    void shouldRejectUnknownLedgerBackend() {
        PipelineProperties properties = new PipelineProperties();
        properties.setLedger("redis");

        assertThatThrownBy(properties::validate).hasMessageContaining("og.pipeline.ledger");
    }

    @Test
    void shouldRejectZeroRedirectPollInterval() {
        PipelineProperties properties = new PipelineProperties();
        properties.setRedirectPollInterval(Duration.ZERO);

        assertThatThrownBy(properties::validate).hasMessageContaining("redirect-poll-interval");
    }

    @Test
    void normalizedAllowedDomains_trimsLowercasesAndDropsBlanks() {
        PipelineProperties properties = new PipelineProperties();
        properties.setAllowedDomains(Arrays.asList(" Example.COM ", "", null, "blog.test"));

        assertThat(properties.normalizedAllowedDomains()).containsExactly("example.com", "blog.test");
    }
}
