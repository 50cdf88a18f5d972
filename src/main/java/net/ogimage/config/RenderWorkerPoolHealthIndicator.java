package net.ogimage.config;

import net.ogimage.application.render.RenderWorkerPool;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes render worker pool state under {@code /actuator/health}.
 */
@Component("renderWorkersHealthIndicator")
public class RenderWorkerPoolHealthIndicator implements HealthIndicator {

    private final RenderWorkerPool workerPool;

    public RenderWorkerPoolHealthIndicator(RenderWorkerPool workerPool) {
        this.workerPool = workerPool;
    }

    @Override
    public Health health() {
        Health.Builder builder = workerPool.isRunning() ? Health.up() : Health.down();
        return builder
            .withDetail("workers", workerPool.workerCount())
            .withDetail("busy", workerPool.busyWorkers())
            .build();
    }
}
