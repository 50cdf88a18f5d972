package net.ogimage.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Clock;
import net.ogimage.application.render.ArtifactStore;
import net.ogimage.application.render.PageRenderer;
import net.ogimage.support.render.SeleniumPageRenderer;
import net.ogimage.support.s3.S3ArtifactStore;
import net.ogimage.support.s3.S3ObjectStorageGateway;
import net.ogimage.support.storage.CachingArtifactStore;
import net.ogimage.support.storage.LocalDiskArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3Client;
import tools.jackson.databind.ObjectMapper;

/**
 * Wires the pipeline's collaborators: clock, render time limiter, renderer and artifact store.
 */
@Configuration
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);
    private static final String LOOKUP_CACHE_NAME = "artifactLookups";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Hard per-render timeout. The running render is interrupted when it fires.
     */
    @Bean
    public TimeLimiter renderTimeLimiter(PipelineProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
            .timeoutDuration(properties.getRenderTimeout())
            .cancelRunningFuture(true)
            .build();
        logger.info("Render time limiter initialized with timeout {}s", properties.getRenderTimeout().toSeconds());
        return TimeLimiter.of("pageRender", config);
    }

    @Bean
    @ConditionalOnMissingBean(PageRenderer.class)
    public PageRenderer pageRenderer() {
        return new SeleniumPageRenderer();
    }

    @Bean
    @ConditionalOnProperty(prefix = "og.pipeline", name = "artifact-store", havingValue = "s3", matchIfMissing = true)
    public S3ObjectStorageGateway s3ObjectStorageGateway(ObjectProvider<S3Client> s3Client, S3StorageProperties s3) {
        S3ObjectStorageGateway gateway = new S3ObjectStorageGateway(
            s3Client.getIfAvailable(), s3.getBucketName(), s3.getPublicCdnUrl(), s3.getServerUrl());
        gateway.validateConfiguration();
        return gateway;
    }

    @Bean
    @ConditionalOnProperty(prefix = "og.pipeline", name = "artifact-store", havingValue = "s3", matchIfMissing = true)
    public ArtifactStore s3ArtifactStore(S3ObjectStorageGateway gateway, PipelineProperties properties, Clock clock,
                                         MeterRegistry meterRegistry) {
        logger.info("Using S3 artifact store (bucket {}, prefix '{}')", gateway.bucketName(), properties.getArtifactKeyPrefix());
        return new CachingArtifactStore(
            new S3ArtifactStore(gateway, properties.getArtifactKeyPrefix(), clock),
            properties.getLookupCacheSize(),
            clock).bindMetrics(meterRegistry, LOOKUP_CACHE_NAME);
    }

    @Bean
    @ConditionalOnProperty(prefix = "og.pipeline", name = "artifact-store", havingValue = "local")
    public ArtifactStore localArtifactStore(PipelineProperties properties, ObjectMapper objectMapper, Clock clock,
                                            MeterRegistry meterRegistry) {
        logger.info("Using local disk artifact store at {}", properties.getLocalStorageDir());
        return new CachingArtifactStore(
            new LocalDiskArtifactStore(Path.of(properties.getLocalStorageDir()), properties.getLocalPublicBaseUrl(), objectMapper, clock),
            properties.getLookupCacheSize(),
            clock).bindMetrics(meterRegistry, LOOKUP_CACHE_NAME);
    }
}
