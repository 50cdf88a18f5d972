package net.ogimage.config;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import net.ogimage.exception.StorageUnavailableException;
import net.ogimage.support.s3.S3ObjectStorageGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reports whether the artifact store can reach its bucket, and where artifacts land inside it.
 */
@Component("artifactStoreHealthIndicator")
@ConditionalOnProperty(prefix = "og.pipeline", name = "artifact-store", havingValue = "s3", matchIfMissing = true)
public class S3HealthIndicator implements ReactiveHealthIndicator {

    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final S3ObjectStorageGateway gateway;
    private final String artifactPrefix;

    public S3HealthIndicator(S3ObjectStorageGateway gateway, PipelineProperties properties) {
        this.gateway = gateway;
        this.artifactPrefix = properties.getArtifactKeyPrefix();
    }

    @Override
    public Mono<Health> health() {
        if (!gateway.isConfigured()) {
            return Mono.just(Health.down()
                .withDetail("artifact_store", "s3")
                .withDetail("s3_status", "unconfigured")
                .withDetail("detail", "S3 credentials or bucket name are missing; renders cannot be stored.")
                .build());
        }
        return Mono.fromCallable(() -> {
                gateway.verifyBucketAccess();
                return details(Health.up(), "available").build();
            })
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(CHECK_TIMEOUT)
            .onErrorResume(StorageUnavailableException.class, ex -> Mono.just(details(Health.down(), "unreachable")
                .withDetail("error", ex.getMessage())
                .build()))
            .onErrorResume(TimeoutException.class, ex -> Mono.just(details(Health.down(), "timeout")
                .withDetail("error", "No answer from S3 within " + CHECK_TIMEOUT.toSeconds() + "s")
                .build()));
    }

    private Health.Builder details(Health.Builder builder, String status) {
        return builder
            .withDetail("artifact_store", "s3")
            .withDetail("s3_status", status)
            .withDetail("bucket", gateway.bucketName())
            .withDetail("artifact_prefix", artifactPrefix)
            .withDetail("sample_url", gateway.resolvePublicUrl(artifactPrefix + "<fingerprint>.png"));
    }
}
